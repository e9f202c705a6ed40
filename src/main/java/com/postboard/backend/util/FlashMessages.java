package com.postboard.backend.util;

import org.springframework.ui.Model;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * One-line status messages shown at the top of every page by the {@code fragments/layout :: messages}
 * fragment. Categories map to CSS classes: success, error, info.
 */
public final class FlashMessages {

    public static final String MESSAGE_ATTRIBUTE = "flashMessage";
    public static final String CATEGORY_ATTRIBUTE = "flashCategory";

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String INFO = "info";

    private FlashMessages() {
    }

    // survives the redirect
    public static void flash(RedirectAttributes redirectAttributes, String category, String message) {
        redirectAttributes.addFlashAttribute(MESSAGE_ATTRIBUTE, message);
        redirectAttributes.addFlashAttribute(CATEGORY_ATTRIBUTE, category);
    }

    // rendered by the current view only
    public static void inline(Model model, String category, String message) {
        model.addAttribute(MESSAGE_ATTRIBUTE, message);
        model.addAttribute(CATEGORY_ATTRIBUTE, category);
    }
}
