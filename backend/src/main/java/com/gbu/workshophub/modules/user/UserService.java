package com.gbu.workshophub.modules.user;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.modules.user.dto.*;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final SecurityUtils securityUtils;

    @Transactional(readOnly = true)
    public UserProfileDto getMyProfile() {
        return toDto(findUser(securityUtils.getCurrentUserId()));
    }

    @Transactional
    public UserProfileDto updateMyProfile(UpdateProfileRequest request) {
        User user = findUser(securityUtils.getCurrentUserId());

        String name = request.getName().trim();
        if (name.isEmpty() || name.codePointCount(0, name.length()) > 100) {
            throw new BusinessException("Name must be 1-100 characters");
        }
        user.setName(name);

        return toDto(userRepository.saveAndFlush(user));
    }

    /**
     * Hard-deletes the caller. Participations, progress, submissions, attempts and points
     * go with the row; owned workshops survive with no owner.
     */
    @Transactional
    public void deleteMyAccount() {
        User user = findUser(securityUtils.getCurrentUserId());
        userRepository.delete(user);
        log.info("User {} deleted their account", user.getId());
    }

    @Transactional(readOnly = true)
    public User findUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId.toString()));
    }

    /** Row-locks the user until the surrounding transaction ends. */
    @Transactional
    public User lockUser(UUID userId) {
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId.toString()));
    }

    public UserProfileDto toDto(User user) {
        return UserProfileDto.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
