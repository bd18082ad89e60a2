package io.gdcc.repository.collections.query;

import io.gdcc.repository.collections.config.CollectionsConfig;
import io.gdcc.repository.collections.error.BackendUnavailableException;
import io.gdcc.repository.collections.error.InvalidArgumentException;
import io.gdcc.repository.collections.error.NotFoundException;
import io.gdcc.repository.collections.rels.Vocabulary;
import io.gdcc.repository.collections.repository.Pid;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.apache.jena.atlas.web.HttpException;
import org.apache.jena.datatypes.DatatypeFormatException;
import org.apache.jena.datatypes.xsd.XSDDateTime;
import org.apache.jena.query.ParameterizedSparqlString;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.shared.JenaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SPARQL implementation of {@link QueryBackend}. Caller values are bound into parameterized
 * queries as RDF terms, so a text filter can only ever match as a literal substring.
 *
 * <p>Listings return one row per member even when its label, owner or date is multi-valued, so
 * pages line up with the distinct member count. Subclasses decide where queries run.
 */
public abstract class SparqlQueryBackend implements QueryBackend {
    private static final Logger LOG = LoggerFactory.getLogger(SparqlQueryBackend.class);

    private static final String MEMBER_PATTERN =
            "  { ?object rels:isMemberOfCollection ?collection }\n"
                    + "  UNION { ?object rels:isMemberOf ?collection }\n"
                    + "  FILTER(isIRI(?object))\n";

    private static final String MEMBERS_QUERY =
            "SELECT ?object (MIN(?t) AS ?title) (MIN(?o) AS ?owner) (MAX(?m) AS ?modified)"
                    + " WHERE {\n"
                    + MEMBER_PATTERN
                    + "  %s\n"
                    + "  OPTIONAL { ?object fm:label ?t }\n"
                    + "  OPTIONAL { ?object fm:ownerId ?o }\n"
                    + "  OPTIONAL { ?object fv:lastModifiedDate ?m }\n"
                    + "}\n"
                    + "GROUP BY ?object\n"
                    + "ORDER BY ?title ?object";

    private static final String COUNT_QUERY =
            "SELECT (COUNT(DISTINCT ?object) AS ?count) WHERE {\n"
                    + MEMBER_PATTERN
                    + "  %s\n"
                    + "}";

    private static final String COLLECTIONS_QUERY =
            "SELECT ?object (MIN(?l) AS ?label) WHERE {\n"
                    + "  ?object fm:hasModel ?model .\n"
                    + "  FILTER(isIRI(?object))\n"
                    + "  FILTER NOT EXISTS { ?object fm:state fm:Deleted }\n"
                    + "  OPTIONAL { ?object fm:label ?l }\n"
                    + "  BIND(LCASE(STR(COALESCE(?l, \"\"))) AS ?labelText)\n"
                    + "  BIND(LCASE(STRAFTER(STR(?object), \"info:fedora/\")) AS ?pidText)\n"
                    + "  FILTER(CONTAINS(?labelText, LCASE(?filter))"
                    + " || CONTAINS(?pidText, LCASE(?filter)))\n"
                    + "}\n"
                    + "GROUP BY ?object\n"
                    + "ORDER BY ?label ?object";

    private static final String EXISTS_QUERY = "ASK { ?subject ?p ?o }";

    private final CollectionsConfig config;

    protected SparqlQueryBackend(CollectionsConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Runs the query wherever this backend lives. The caller closes the execution. */
    protected abstract QueryExecution execution(Query query);

    public CollectionsConfig config() {
        return config;
    }

    /**
     * @throws InvalidArgumentException for a bad page, a limit outside 1..maxPageSize or a
     *     malformed PID
     * @throws NotFoundException when the collection object does not exist
     */
    @Override
    public PageResult queryMembers(
            String collectionPid, int page, int limit, FilterMode filterMode) {
        return queryMembers(collectionPid, config.pageRequest(page, limit), filterMode);
    }

    /** Same as {@link #queryMembers(String, int, int, FilterMode)} with the default page size. */
    public PageResult queryMembers(String collectionPid, int page, FilterMode filterMode) {
        return queryMembers(collectionPid, config.pageRequest(page, null), filterMode);
    }

    private PageResult queryMembers(
            String collectionPid, PageRequest request, FilterMode filterMode) {
        if (filterMode == null) {
            throw new InvalidArgumentException("filterMode must not be null");
        }
        Pid collection = Pid.parse(collectionPid);
        if (!exists(collection)) {
            throw new NotFoundException(collection.toString());
        }

        long total = count(collection, filterMode);
        Query query = prepare(MEMBERS_QUERY, filterMode, collection).asQuery();
        query.setLimit(request.limit());
        query.setOffset(request.offset());

        List<MemberRecord> items =
                select(
                        query,
                        solution ->
                                new MemberRecord(
                                        Vocabulary.toPid(solution.getResource("object").getURI()),
                                        lexical(solution.get("title")),
                                        lexical(solution.get("owner")),
                                        instant(solution.get("modified"))));
        LOG.debug(
                "Collection {} page {} ({} per page): {} of {} member(s)",
                collection,
                request.page(),
                request.limit(),
                items.size(),
                total);
        return new PageResult(total, items, request.page(), request.limit());
    }

    @Override
    public List<CollectionCandidate> findCollections(String contentModel, String textFilter) {
        Pid model = Pid.parse(contentModel);
        ParameterizedSparqlString pss = parameterized(COLLECTIONS_QUERY);
        pss.setIri("model", model.uri());
        pss.setLiteral("filter", textFilter == null ? "" : textFilter.trim());
        return select(
                pss.asQuery(),
                solution ->
                        new CollectionCandidate(
                                Vocabulary.toPid(solution.getResource("object").getURI()),
                                lexical(solution.get("label"))));
    }

    private boolean exists(Pid pid) {
        ParameterizedSparqlString pss = parameterized(EXISTS_QUERY);
        pss.setIri("subject", pid.uri());
        try (QueryExecution qexec = execution(pss.asQuery())) {
            return qexec.execAsk();
        } catch (JenaException | HttpException e) {
            throw unavailable(e);
        }
    }

    private long count(Pid collection, FilterMode filterMode) {
        List<Long> counts =
                select(
                        prepare(COUNT_QUERY, filterMode, collection).asQuery(),
                        solution -> solution.getLiteral("count").getLong());
        return counts.isEmpty() ? 0L : counts.get(0);
    }

    private static ParameterizedSparqlString prepare(
            String template, FilterMode filterMode, Pid collection) {
        ParameterizedSparqlString pss =
                parameterized(String.format(template, stateFilter(filterMode)));
        pss.setIri("collection", collection.uri());
        return pss;
    }

    /** VIEW needs every state of the member to be Active (or none at all). */
    private static String stateFilter(FilterMode filterMode) {
        return switch (filterMode) {
            case VIEW -> "FILTER NOT EXISTS { ?object fm:state ?s . FILTER(?s != fm:Active) }";
            case MANAGE -> "FILTER NOT EXISTS { ?object fm:state fm:Deleted }";
        };
    }

    private static ParameterizedSparqlString parameterized(String body) {
        ParameterizedSparqlString pss = new ParameterizedSparqlString();
        pss.setNsPrefix("rels", Vocabulary.RELS_EXT_URI);
        pss.setNsPrefix("fm", Vocabulary.FEDORA_MODEL_URI);
        pss.setNsPrefix("fv", Vocabulary.FEDORA_VIEW_URI);
        pss.append(body);
        return pss;
    }

    private <T> List<T> select(Query query, Function<QuerySolution, T> mapper) {
        List<T> out = new ArrayList<>();
        try (QueryExecution qexec = execution(query)) {
            ResultSet rs = qexec.execSelect();
            while (rs.hasNext()) {
                out.add(mapper.apply(rs.nextSolution()));
            }
        } catch (JenaException | HttpException e) {
            throw unavailable(e);
        }
        return out;
    }

    private static BackendUnavailableException unavailable(RuntimeException e) {
        return new BackendUnavailableException("Query service failed: " + e.getMessage(), e);
    }

    private static String lexical(RDFNode node) {
        if (node == null) {
            return null;
        }
        return node.isLiteral() ? node.asLiteral().getLexicalForm() : node.toString();
    }

    private static Instant instant(RDFNode node) {
        if (node == null || !node.isLiteral()) {
            return null;
        }
        Literal literal = node.asLiteral();
        try {
            Object value = literal.getValue();
            if (value instanceof XSDDateTime) {
                return ((XSDDateTime) value).asCalendar().toInstant();
            }
            return OffsetDateTime.parse(literal.getLexicalForm()).toInstant();
        } catch (DatatypeFormatException | DateTimeParseException e) {
            LOG.debug("Ignoring unparseable modification date '{}'", literal.getLexicalForm());
            return null;
        }
    }
}
