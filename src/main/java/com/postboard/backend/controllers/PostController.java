package com.postboard.backend.controllers;

import com.postboard.backend.auth.SessionUser;
import com.postboard.backend.exceptions.PostCreationException;
import com.postboard.backend.payload.CreatePostForm;
import com.postboard.backend.services.PostService;
import com.postboard.backend.util.FlashMessages;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

@Controller
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    @GetMapping("/posts")
    public String posts(Model model) {
        model.addAttribute("posts", postService.getAllPosts());
        return "posts";
    }

    @GetMapping("/create_post")
    public String createPostPage(@ModelAttribute("form") CreatePostForm form) {
        return "create_post";
    }

    @PostMapping("/create_post")
    public String createPost(@AuthenticationPrincipal SessionUser user,
                             @Valid @ModelAttribute("form") CreatePostForm form,
                             BindingResult bindingResult,
                             Model model,
                             RedirectAttributes redirectAttributes) {
        if (bindingResult.hasErrors()) {
            FlashMessages.inline(model, FlashMessages.ERROR, bindingResult.getAllErrors().get(0).getDefaultMessage());
            return "create_post";
        }

        try {
            postService.createForUser(user.getId(), form.getTitle(), form.getContent());
        } catch (PostCreationException e) {
            FlashMessages.inline(model, FlashMessages.ERROR, e.getMessage());
            return "create_post";
        }

        FlashMessages.flash(redirectAttributes, FlashMessages.SUCCESS, "Post created successfully!");
        return "redirect:/posts";
    }
}
