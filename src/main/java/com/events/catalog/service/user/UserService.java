package com.events.catalog.service.user;

import com.events.catalog.common.exception.DuplicateEmailException;
import com.events.catalog.common.exception.UserNotFoundException;
import com.events.catalog.domain.User;
import com.events.catalog.dto.user.UserRequest;
import com.events.catalog.dto.user.UserResponse;
import com.events.catalog.repository.UserRepository;
import com.events.catalog.service.registration.UserLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService implements UserLookup {

    private final UserRepository userRepository;

    @Transactional
    public UserResponse createUser(UserRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw new DuplicateEmailException("이미 사용 중인 이메일입니다: " + request.email());
        }
        User user = User.create(request.email(), request.name());
        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 동시 가입으로 유니크 제약에 걸린 경우
            throw new DuplicateEmailException("이미 사용 중인 이메일입니다: " + request.email());
        }
        log.info("사용자 생성: userId={}", user.getId());
        return UserResponse.from(user);
    }

    public UserResponse getUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException("사용자를 찾을 수 없습니다: " + userId));
        return UserResponse.from(user);
    }

    @Override
    public boolean exists(Long userId) {
        return userRepository.existsById(userId);
    }
}
