package io.gdcc.repository.collections.query;

import io.gdcc.repository.collections.config.CollectionsConfig;
import java.util.Objects;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.rdf.model.Model;

/** Runs membership queries against an in-process Jena model. */
public class ModelQueryBackend extends SparqlQueryBackend {
    private final Model model;

    public ModelQueryBackend(Model model) {
        this(model, CollectionsConfig.defaults());
    }

    public ModelQueryBackend(Model model, CollectionsConfig config) {
        super(config);
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    protected QueryExecution execution(Query query) {
        return QueryExecutionFactory.create(query, model);
    }
}
