package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.protocol.api.MessageResponse;
import io.github.drompincen.fixflow.protocol.api.UserDto;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.user.UserAdminService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserAdminService userAdminService;

    public UserController(UserAdminService userAdminService) {
        this.userAdminService = userAdminService;
    }

    @GetMapping
    public List<UserDto> list(@AuthenticationPrincipal CurrentUser user) {
        return userAdminService.list(user).stream().map(this::toDto).collect(Collectors.toList());
    }

    @PatchMapping("/{userId}")
    public UserDto update(@PathVariable String userId, @RequestBody Map<String, Object> updates,
                          @AuthenticationPrincipal CurrentUser user) {
        return toDto(userAdminService.update(userId, updates, user));
    }

    @DeleteMapping("/{userId}")
    public MessageResponse deactivate(@PathVariable String userId, @AuthenticationPrincipal CurrentUser user) {
        userAdminService.deactivate(userId, user);
        return new MessageResponse("User deactivated successfully");
    }

    private UserDto toDto(UserDocument u) {
        return new UserDto(u.getId(), u.getEmail(), u.getName(), u.getRole(), u.getPicture(), u.isActive(),
                u.getCreatedAt());
    }
}
