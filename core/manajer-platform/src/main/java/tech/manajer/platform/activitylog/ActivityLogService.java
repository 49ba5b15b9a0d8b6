package tech.manajer.platform.activitylog;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Writes and reads the activity log.
 *
 * Logging an action never fails the action itself: a storage error is logged
 * and dropped.
 */
@ApplicationScoped
public class ActivityLogService {

    private static final Logger LOG = Logger.getLogger(ActivityLogService.class);

    public static final int MAX_PAGE_SIZE = 200;

    private final ActivityLogRepository repository;

    @Inject
    public ActivityLogService(ActivityLogRepository repository) {
        this.repository = repository;
    }

    public void logActivity(ObjectId userId, String action, String method, String endpoint,
                            int statusCode, String ipAddress) {
        ActivityLog entry = new ActivityLog();
        entry.userId = userId;
        entry.action = action;
        entry.method = method;
        entry.endpoint = endpoint;
        entry.statusCode = statusCode;
        entry.ipAddress = ipAddress;

        try {
            repository.persist(entry);
            LOG.debugf("Recorded activity [%s] by user [%s]", action, userId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record activity [%s] by user [%s]", action, userId);
        }
    }

    /**
     * List entries newest first.
     *
     * @param page zero-based page index
     * @param size page size, capped at {@link #MAX_PAGE_SIZE}
     */
    public List<ActivityLog> findPaged(int page, int size) {
        return repository.findPaged(page, Math.min(size, MAX_PAGE_SIZE));
    }

    public long count() {
        return repository.count();
    }
}
