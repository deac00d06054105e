package tdsc.blog.engagement.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tdsc.blog.engagement.domain.AuthoredComment;
import tdsc.blog.engagement.domain.Comment;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.dto.CommentResponse;
import tdsc.blog.engagement.exception.CommentNotFoundException;
import tdsc.blog.engagement.exception.ForbiddenOperationException;
import tdsc.blog.engagement.exception.ValidationException;
import tdsc.blog.engagement.mapper.CommentMapper;
import tdsc.blog.engagement.validation.CodePointLengthValidator;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Comment store for posts
 */
@Slf4j
@Service
public class CommentService {

    public static final int MAX_TEXT_LENGTH = 2000;

    @Autowired
    private CommentMapper commentMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Comments on a post, newest first
     *
     * @param postSlug     the post key
     * @param callerUserId the caller, or null when anonymous; drives {@code is_own}
     */
    public List<CommentResponse> listComments(String postSlug, Long callerUserId) {
        List<AuthoredComment> rows = commentMapper.findBySlugWithAuthor(postSlug);
        log.debug("Listed comments: slug={}, count={}", postSlug, rows.size());
        return rows.stream()
                .map(row -> CommentResponse.fromComment(row, row.getUsername(),
                        callerUserId != null && callerUserId.equals(row.getUserId())))
                .collect(Collectors.toList());
    }

    /**
     * Add a comment authored by the caller
     *
     * @throws ValidationException if the text is empty or longer than 2000 characters (code points)
     */
    public CommentResponse createComment(String postSlug, User author, String text) {
        if (text == null || text.isEmpty() || CodePointLengthValidator.codePointLength(text) > MAX_TEXT_LENGTH) {
            throw new ValidationException("Text must be between 1 and " + MAX_TEXT_LENGTH + " characters");
        }

        Comment comment = Comment.builder()
                .userId(author.getUserId())
                .postSlug(postSlug)
                .text(text)
                .createdAt(LocalDateTime.now())
                .build();
        commentMapper.insert(comment);

        meterRegistry.counter("blog.comments.created").increment();
        log.info("Comment created: commentId={}, slug={}, userId={}",
                comment.getCommentId(), postSlug, author.getUserId());
        return CommentResponse.fromComment(comment, author.getUsername(), true);
    }

    /**
     * Delete a comment. Existence is checked first, then authorship.
     *
     * @param commentId    raw id from the request path; a non-numeric id is treated as not found
     * @param callerUserId the caller
     * @throws CommentNotFoundException    if no such comment exists
     * @throws ForbiddenOperationException if the caller is not the author
     */
    public void deleteComment(String commentId, Long callerUserId) {
        Long id = parseId(commentId);
        Comment comment = id != null ? commentMapper.findById(id) : null;
        if (comment == null) {
            log.info("Comment deletion failed - not found: commentId={}", commentId);
            throw new CommentNotFoundException("Comment not found");
        }
        if (!Objects.equals(comment.getUserId(), callerUserId)) {
            log.info("Comment deletion failed - not author: commentId={}, userId={}", commentId, callerUserId);
            throw new ForbiddenOperationException("You can only delete your own comments");
        }

        commentMapper.deleteById(id);
        meterRegistry.counter("blog.comments.deleted").increment();
        log.info("Comment deleted: commentId={}, userId={}", id, callerUserId);
    }

    private static Long parseId(String raw) {
        try {
            return Long.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
