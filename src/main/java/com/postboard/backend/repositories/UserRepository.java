package com.postboard.backend.repositories;

import com.postboard.backend.models.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    List<User> findAllByOrderByIdAsc();

    /**
     * Every user except the given one, used as the recipient list when a post fans out.
     */
    List<User> findByIdNotOrderByIdAsc(Long excludedUserId);
}
