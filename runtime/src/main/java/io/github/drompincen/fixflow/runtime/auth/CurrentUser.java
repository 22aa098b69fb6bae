package io.github.drompincen.fixflow.runtime.auth;

import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.protocol.api.UserRole;

/** The authenticated caller of a request. */
public record CurrentUser(String id, String email, String name, UserRole role, String picture) {

    public static CurrentUser from(UserDocument user) {
        return new CurrentUser(user.getId(), user.getEmail(), user.getName(), user.getRole(), user.getPicture());
    }
}
