package io.gdcc.repository.collections.repository;

import io.gdcc.repository.collections.rels.JenaRelationshipStore;
import io.gdcc.repository.collections.rels.Vocabulary;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.Objects;
import java.util.Optional;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Object repository over a Jena {@link Model} holding RELS-EXT and Fedora model properties of
 * every object. The same model can back a {@code ModelQueryBackend}.
 */
public class JenaObjectRepository implements ObjectRepository {
    private static final Logger LOG = LoggerFactory.getLogger(JenaObjectRepository.class);

    private final Model model;
    private final Clock clock;

    public JenaObjectRepository(Model model) {
        this(model, Clock.systemUTC());
    }

    public JenaObjectRepository(Model model, Clock clock) {
        this.model = Objects.requireNonNull(model, "model");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Model model() {
        return model;
    }

    @Override
    public Optional<RepositoryObject> find(Pid pid) {
        Resource subject = model.createResource(pid.uri());
        if (!model.contains(subject, null, (RDFNode) null)) {
            return Optional.empty();
        }
        return Optional.of(
                new RepositoryObject(pid, new JenaRelationshipStore(model, pid.toString())));
    }

    /**
     * Creates an object with its label, owner, state and content models. Re-ingesting an
     * existing PID replaces those properties and keeps its relationships.
     *
     * @param state one of the {@code Vocabulary.STATE_*} URIs, or {@code null} for Active
     */
    public RepositoryObject ingest(
            String pid, String label, String owner, String state, String... contentModels) {
        Pid parsed = Pid.parse(pid);
        Resource subject = model.createResource(parsed.uri());
        replace(
                subject,
                Vocabulary.FEDORA_MODEL_URI,
                Vocabulary.LABEL,
                label == null ? null : model.createLiteral(label));
        replace(
                subject,
                Vocabulary.FEDORA_MODEL_URI,
                Vocabulary.OWNER_ID,
                owner == null ? null : model.createLiteral(owner));
        replace(
                subject,
                Vocabulary.FEDORA_MODEL_URI,
                Vocabulary.STATE,
                model.createResource(state == null ? Vocabulary.STATE_ACTIVE : state));
        Property hasModel = model.createProperty(Vocabulary.FEDORA_MODEL_URI, Vocabulary.HAS_MODEL);
        for (String contentModel : contentModels) {
            model.add(subject, hasModel, model.createResource(Vocabulary.toUri(contentModel)));
        }
        RepositoryObject object =
                new RepositoryObject(parsed, new JenaRelationshipStore(model, parsed.toString()));
        touch(object);
        LOG.debug("Ingested {} with models {}", parsed, (Object) contentModels);
        return object;
    }

    @Override
    public void touch(RepositoryObject object) {
        Resource subject = model.createResource(object.pid().uri());
        Calendar now = GregorianCalendar.from(clock.instant().atZone(ZoneOffset.UTC));
        replace(
                subject,
                Vocabulary.FEDORA_VIEW_URI,
                Vocabulary.LAST_MODIFIED_DATE,
                model.createTypedLiteral(now));
    }

    private void replace(Resource subject, String namespace, String name, RDFNode value) {
        Property property = model.createProperty(namespace, name);
        subject.removeAll(property);
        if (value != null) {
            subject.addProperty(property, value);
        }
    }
}
