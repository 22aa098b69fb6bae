package io.github.drompincen.fixflow.runtime.notification;

import io.github.drompincen.fixflow.persistence.document.NotificationDocument;
import io.github.drompincen.fixflow.persistence.repository.NotificationRepository;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final MongoTemplate mongoTemplate;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, MongoTemplate mongoTemplate,
                               AccessPolicy accessPolicy, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.mongoTemplate = mongoTemplate;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    /** Records an unread notification for the recipient. */
    public NotificationDocument notify(String userId, String title, String message, String link) {
        NotificationDocument notification = new NotificationDocument();
        notification.setUserId(userId);
        notification.setTitle(title);
        notification.setMessage(message);
        notification.setLink(link);
        notification.setRead(false);
        notification.setCreatedAt(clock.instant());
        NotificationDocument saved = notificationRepository.save(notification);
        log.debug("Notified user {}: {}", userId, title);
        return saved;
    }

    public List<NotificationDocument> listFor(CurrentUser user) {
        accessPolicy.check(user, Operation.NOTIFICATION_ACCESS);
        return notificationRepository.findTop50ByUserIdOrderByCreatedAtDesc(user.id());
    }

    /** Idempotent. Another user's notification is reported as missing. */
    public void markRead(String notificationId, CurrentUser user) {
        accessPolicy.check(user, Operation.NOTIFICATION_ACCESS);
        NotificationDocument notification = notificationRepository.findByIdAndUserId(notificationId, user.id())
                .orElseThrow(() -> FixFlowException.notFound("Notification not found"));
        if (!notification.isRead()) {
            notification.setRead(true);
            notificationRepository.save(notification);
        }
    }

    public long markAllRead(CurrentUser user) {
        accessPolicy.check(user, Operation.NOTIFICATION_ACCESS);
        long modified = mongoTemplate.updateMulti(
                Query.query(Criteria.where("userId").is(user.id()).and("read").is(false)),
                Update.update("read", true),
                NotificationDocument.class).getModifiedCount();
        log.debug("Marked {} notification(s) read for user {}", modified, user.id());
        return modified;
    }
}
