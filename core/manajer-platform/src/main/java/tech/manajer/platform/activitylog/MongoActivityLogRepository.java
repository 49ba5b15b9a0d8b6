package tech.manajer.platform.activitylog;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import org.bson.types.ObjectId;

import java.util.List;

/**
 * MongoDB implementation of ActivityLogRepository.
 * Package-private to prevent direct injection - use ActivityLogRepository interface.
 */
@ApplicationScoped
@Typed(ActivityLogRepository.class)
class MongoActivityLogRepository implements PanacheMongoRepositoryBase<ActivityLog, ObjectId>, ActivityLogRepository {

    @Override
    public List<ActivityLog> findPaged(int page, int pageSize) {
        return findAll(Sort.descending("createdAt"))
            .page(page, pageSize)
            .list();
    }

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(ActivityLog log) {
        PanacheMongoRepositoryBase.super.persist(log);
    }
}
