package com.postboard.backend.util;

import com.postboard.backend.dto.PostDto;
import com.postboard.backend.models.Post;

import java.util.List;
import java.util.stream.Collectors;

public class PostMapper {

    /**
     * Touches the author association, so call it while the persistence context is open
     * or on a post whose author was fetched.
     */
    public static PostDto toDTO(Post post) {
        return PostDto.builder()
                .id(post.getId())
                .title(post.getTitle())
                .content(post.getContent())
                .author(post.getAuthor() != null ? post.getAuthor().getUsername() : null)
                .createdAt(post.getCreatedAt())
                .build();
    }

    public static List<PostDto> toDTOList(List<Post> posts) {
        return posts.stream()
                .map(PostMapper::toDTO)
                .collect(Collectors.toList());
    }
}
