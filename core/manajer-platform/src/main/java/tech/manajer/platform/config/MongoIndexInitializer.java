package tech.manajer.platform.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Initializes MongoDB indexes on application startup.
 */
@ApplicationScoped
public class MongoIndexInitializer {

    private static final Logger LOG = Logger.getLogger(MongoIndexInitializer.class);

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    void onStart(@Observes StartupEvent ev) {
        LOG.info("Initializing MongoDB indexes...");
        MongoDatabase db = mongoClient.getDatabase(databaseName);

        createMessageIndexes(db);
        createActivityLogIndexes(db);

        LOG.info("MongoDB indexes initialized successfully");
    }

    private void createMessageIndexes(MongoDatabase db) {
        MongoCollection<Document> messages = db.getCollection("messages");
        // Channel history, newest first
        messages.createIndex(
            Indexes.compoundIndex(Indexes.ascending("channelId"), Indexes.descending("createdAt")),
            new IndexOptions());
    }

    private void createActivityLogIndexes(MongoDatabase db) {
        MongoCollection<Document> logs = db.getCollection("activity_logs");
        logs.createIndex(Indexes.descending("createdAt"), new IndexOptions());
        logs.createIndex(Indexes.ascending("userId"), new IndexOptions());
    }
}
