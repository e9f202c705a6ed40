package com.postboard.backend.services;

import com.postboard.backend.dto.UserDto;
import com.postboard.backend.exceptions.UserNotFoundException;
import com.postboard.backend.repositories.UserRepository;
import com.postboard.backend.util.UserMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<UserDto> getAllUsers() {
        return UserMapper.toDTOList(userRepository.findAllByOrderByIdAsc());
    }

    @Transactional(readOnly = true)
    public UserDto getById(Long userId) {
        return userRepository.findById(userId)
                .map(UserMapper::toDTO)
                .orElseThrow(() -> new UserNotFoundException("#" + userId));
    }
}
