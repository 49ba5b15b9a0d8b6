package tech.manajer.platform.activitylog;

import java.util.List;

/**
 * Repository interface for ActivityLog entities.
 * Exposes only approved data access methods - Panache internals are hidden.
 */
public interface ActivityLogRepository {

    // Read operations
    List<ActivityLog> findPaged(int page, int pageSize);
    long count();

    // Write operations
    void persist(ActivityLog log);
}
