package io.gdcc.repository.collections.rels;

import java.util.List;
import java.util.Objects;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;

/** {@link RelationshipStore} over the statements of one subject in a Jena {@link Model}. */
public class JenaRelationshipStore implements RelationshipStore {
    private final Model model;
    private final String subjectPid;
    private final Resource subject;

    public JenaRelationshipStore(Model model, String subjectPid) {
        this.model = Objects.requireNonNull(model, "model");
        this.subjectPid = Objects.requireNonNull(subjectPid, "subjectPid");
        this.subject = model.createResource(Vocabulary.toUri(subjectPid));
    }

    @Override
    public List<RelationshipTriple> get(
            String predicateUri, String predicateName, String valueFilter) {
        return statements(predicateUri, predicateName, valueFilter).stream()
                .map(stmt -> toTriple(predicateUri, predicateName, stmt.getObject()))
                .toList();
    }

    @Override
    public void add(String predicateUri, String predicateName, String value, boolean literal) {
        Objects.requireNonNull(value, "value");
        Property property = model.createProperty(predicateUri, predicateName);
        RDFNode object =
                literal
                        ? model.createLiteral(value)
                        : model.createResource(Vocabulary.toUri(value));
        model.add(subject, property, object);
    }

    @Override
    public void remove(String predicateUri, String predicateName, String value) {
        // collect first, the iterator must not be open while the graph changes
        List<Statement> matches = statements(predicateUri, predicateName, value);
        if (!matches.isEmpty()) {
            model.remove(matches);
        }
    }

    private List<Statement> statements(
            String predicateUri, String predicateName, String valueFilter) {
        Property property = model.createProperty(predicateUri, predicateName);
        return model.listStatements(subject, property, (RDFNode) null).toList().stream()
                .filter(
                        stmt ->
                                valueFilter == null
                                        || valueFilter.equals(valueOf(stmt.getObject())))
                .toList();
    }

    private RelationshipTriple toTriple(String predicateUri, String predicateName, RDFNode node) {
        return new RelationshipTriple(
                subjectPid, predicateUri, predicateName, valueOf(node), node.isLiteral());
    }

    private static String valueOf(RDFNode node) {
        if (node.isLiteral()) {
            return node.asLiteral().getLexicalForm();
        }
        if (node.isURIResource()) {
            return Vocabulary.toPid(node.asResource().getURI());
        }
        // blank node targets carry no PID
        return null;
    }
}
