package io.github.drompincen.fixflow.runtime.user;

import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.persistence.repository.UserRepository;
import io.github.drompincen.fixflow.protocol.api.UserRole;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * User administration. Updates are a whitelist of profile fields; credentials are never
 * writable here.
 */
@Service
public class UserAdminService {

    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);

    static final Set<String> EDITABLE_FIELDS = Set.of("name", "email", "role", "picture", "is_active");
    private static final Set<String> CREDENTIAL_FIELDS = Set.of("password", "password_hash");

    private final UserRepository userRepository;
    private final AccessPolicy accessPolicy;

    public UserAdminService(UserRepository userRepository, AccessPolicy accessPolicy) {
        this.userRepository = userRepository;
        this.accessPolicy = accessPolicy;
    }

    public List<UserDocument> list(CurrentUser user) {
        accessPolicy.check(user, Operation.USER_LIST);
        return userRepository.findAll();
    }

    public UserDocument update(String userId, Map<String, Object> updates, CurrentUser user) {
        accessPolicy.check(user, Operation.USER_UPDATE);
        for (String field : updates.keySet()) {
            if (CREDENTIAL_FIELDS.contains(field)) {
                throw FixFlowException.badRequest("Passwords cannot be changed through user updates");
            }
            if (!EDITABLE_FIELDS.contains(field)) {
                throw FixFlowException.badRequest("Unknown field: " + field);
            }
        }

        UserDocument target = userRepository.findById(userId)
                .orElseThrow(() -> FixFlowException.notFound("User not found"));

        for (Map.Entry<String, Object> entry : updates.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "name" -> target.setName(requireText(entry.getKey(), value));
                case "email" -> changeEmail(target, requireText(entry.getKey(), value));
                case "role" -> target.setRole(parseRole(value));
                case "picture" -> target.setPicture(value == null ? null : value.toString());
                case "is_active" -> {
                    if (!(value instanceof Boolean active)) {
                        throw FixFlowException.badRequest("is_active must be a boolean");
                    }
                    target.setActive(active);
                }
                default -> throw FixFlowException.badRequest("Unknown field: " + entry.getKey());
            }
        }

        try {
            target = userRepository.save(target);
        } catch (DuplicateKeyException e) {
            throw FixFlowException.conflict("Email already registered");
        }
        log.info("User {} updated by {}: {}", userId, user.id(), updates.keySet());
        return target;
    }

    /** Soft delete: the account is kept but can no longer authenticate. */
    public void deactivate(String userId, CurrentUser user) {
        accessPolicy.check(user, Operation.USER_DEACTIVATE);
        UserDocument target = userRepository.findById(userId)
                .orElseThrow(() -> FixFlowException.notFound("User not found"));
        target.setActive(false);
        userRepository.save(target);
        log.info("User {} deactivated by {}", userId, user.id());
    }

    private void changeEmail(UserDocument target, String email) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(target.getEmail())) {
            return;
        }
        if (userRepository.existsByEmail(normalized)) {
            throw FixFlowException.conflict("Email already registered");
        }
        target.setEmail(normalized);
    }

    private static String requireText(String field, Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw FixFlowException.badRequest(field + " must be a non-empty string");
        }
        return text;
    }

    private static UserRole parseRole(Object value) {
        if (value == null) {
            throw FixFlowException.badRequest("role must not be null");
        }
        try {
            return UserRole.fromValue(value.toString());
        } catch (IllegalArgumentException e) {
            throw FixFlowException.badRequest(e.getMessage());
        }
    }
}
