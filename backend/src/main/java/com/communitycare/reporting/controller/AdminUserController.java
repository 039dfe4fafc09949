package com.communitycare.reporting.controller;

import com.communitycare.reporting.auth.ActorResolver;
import com.communitycare.reporting.dto.RoleUpdateRequest;
import com.communitycare.reporting.dto.UserDTO;
import com.communitycare.reporting.service.UserManagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/users")
@CrossOrigin(origins = "*")
public class AdminUserController {

    private final UserManagementService userService;
    private final ActorResolver actorResolver;

    public AdminUserController(UserManagementService userService, ActorResolver actorResolver) {
        this.userService = userService;
        this.actorResolver = actorResolver;
    }

    @GetMapping
    public List<UserDTO> list(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        return userService.listUsers(actorResolver.resolve(userId));
    }

    @PutMapping("/{id}/role")
    public UserDTO setRole(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                           @PathVariable("id") Long targetId,
                           @RequestBody RoleUpdateRequest request) {
        return userService.setRole(actorResolver.resolve(userId), targetId, request != null ? request.getRole() : null);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId,
                                       @PathVariable("id") Long targetId) {
        userService.deleteUser(actorResolver.resolve(userId), targetId);
        return ResponseEntity.noContent().build();
    }
}
