package com.postboard.backend.payload;

import com.postboard.backend.models.Post;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostForm {

    @NotBlank(message = "Title and content are required")
    @Size(max = Post.MAX_TITLE_LENGTH, message = "Title must be at most 200 characters")
    private String title;

    @NotBlank(message = "Title and content are required")
    private String content;
}
