package tdsc.blog.engagement.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tdsc.blog.engagement.config.OpenApiConfig;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.dto.CommentResponse;
import tdsc.blog.engagement.dto.CreateCommentRequest;
import tdsc.blog.engagement.dto.MessageResponse;
import tdsc.blog.engagement.security.CurrentUser;
import tdsc.blog.engagement.service.CommentService;

import java.util.List;

/**
 * REST Controller for post comments
 */
@Slf4j
@RestController
@RequestMapping("/posts/{slug}/comments")
@Tag(name = "Comments", description = "Comments on blog posts")
public class CommentController {

    @Autowired
    private CommentService commentService;

    @GetMapping
    @Operation(summary = "List comments", description = "Newest first. Bearer token optional; drives is_own")
    public List<CommentResponse> getComments(
            @Parameter(description = "Post slug", required = true) @PathVariable String slug,
            @Parameter(hidden = true) @CurrentUser(required = false) User caller) {
        return commentService.listComments(slug, caller != null ? caller.getUserId() : null);
    }

    @PostMapping
    @Operation(summary = "Add a comment", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public CommentResponse addComment(
            @Parameter(description = "Post slug", required = true) @PathVariable String slug,
            @Parameter(hidden = true) @CurrentUser User caller,
            @Valid @RequestBody CreateCommentRequest request) {
        log.info("Comment creation: slug={}, userId={}", slug, caller.getUserId());
        return commentService.createComment(slug, caller, request.getText());
    }

    /**
     * Delete a comment; only its author may do so
     */
    @DeleteMapping("/{commentId}")
    @Operation(summary = "Delete a comment", description = "404 if missing, 403 if not the author",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public MessageResponse deleteComment(
            @Parameter(description = "Post slug", required = true) @PathVariable String slug,
            @Parameter(description = "Comment ID", required = true) @PathVariable String commentId,
            @Parameter(hidden = true) @CurrentUser User caller) {
        log.info("Comment deletion: slug={}, commentId={}, userId={}", slug, commentId, caller.getUserId());
        commentService.deleteComment(commentId, caller.getUserId());
        return new MessageResponse("Comment deleted");
    }
}
