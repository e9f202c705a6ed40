package com.postboard.backend.repositories;

import com.postboard.backend.models.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PostRepository extends JpaRepository<Post, Long> {

    List<Post> findTop5ByAuthorIdOrderByCreatedAtDescIdDesc(Long authorId);

    @Query("SELECT p FROM Post p JOIN FETCH p.author ORDER BY p.createdAt DESC, p.id DESC")
    List<Post> findAllWithAuthorNewestFirst();

    long countByAuthorId(Long authorId);
}
