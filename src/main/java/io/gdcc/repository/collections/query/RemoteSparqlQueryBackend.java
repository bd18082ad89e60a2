package io.gdcc.repository.collections.query;

import io.gdcc.repository.collections.config.CollectionsConfig;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.sparql.exec.http.QueryExecutionHTTP;

/**
 * Runs membership queries against a remote SPARQL endpoint, e.g. the resource index of the
 * repository. The timeout comes from {@link CollectionsConfig#queryTimeout()}. Transport errors
 * and timeouts surface as {@link
 * io.gdcc.repository.collections.error.BackendUnavailableException}.
 */
public class RemoteSparqlQueryBackend extends SparqlQueryBackend {
    private final String endpoint;

    public RemoteSparqlQueryBackend(String endpoint, CollectionsConfig config) {
        super(config);
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public String endpoint() {
        return endpoint;
    }

    public Duration timeout() {
        return config().queryTimeout();
    }

    @Override
    protected QueryExecution execution(Query query) {
        return QueryExecutionHTTP.service(endpoint)
                .query(query)
                .timeout(timeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }
}
