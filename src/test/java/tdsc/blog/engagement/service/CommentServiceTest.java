package tdsc.blog.engagement.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import tdsc.blog.engagement.BaseIntegrationTest;
import tdsc.blog.engagement.domain.Comment;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.dto.CommentResponse;
import tdsc.blog.engagement.exception.CommentNotFoundException;
import tdsc.blog.engagement.exception.ForbiddenOperationException;
import tdsc.blog.engagement.exception.ValidationException;
import tdsc.blog.engagement.mapper.CommentMapper;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommentServiceTest extends BaseIntegrationTest {

    @Autowired
    private CommentService commentService;

    @Autowired
    private CommentMapper commentMapper;

    @Test
    @DisplayName("Created comment is returned as the caller's own")
    void testCreateComment() {
        User alice = createUser("alice");

        CommentResponse created = commentService.createComment("p1", alice, "hi");

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getUsername()).isEqualTo("alice");
        assertThat(created.getText()).isEqualTo("hi");
        assertThat(created.getCreatedAt()).isNotNull();
        assertThat(created.isOwn()).isTrue();
    }

    @Test
    @DisplayName("List is newest first and marks the caller's comments")
    void testListNewestFirstWithOwnership() {
        User alice = createUser("alice");
        User bob = createUser("bob");

        commentService.createComment("p1", alice, "first");
        commentService.createComment("p1", bob, "second");
        commentService.createComment("p1", alice, "third");
        commentService.createComment("p2", bob, "elsewhere");

        List<CommentResponse> forAlice = commentService.listComments("p1", alice.getUserId());
        assertThat(forAlice).extracting(CommentResponse::getText)
                .containsExactly("third", "second", "first");
        assertThat(forAlice).extracting(CommentResponse::isOwn)
                .containsExactly(true, false, true);
        assertThat(forAlice).extracting(CommentResponse::getUsername)
                .containsExactly("alice", "bob", "alice");

        List<CommentResponse> anonymous = commentService.listComments("p1", null);
        assertThat(anonymous).hasSize(3).noneMatch(CommentResponse::isOwn);
    }

    @Test
    @DisplayName("Comment whose author is gone is shown as Unknown")
    void testListUnknownAuthor() {
        commentMapper.insert(Comment.builder()
                .userId(424242L)
                .postSlug("p1")
                .text("orphan")
                .createdAt(LocalDateTime.now())
                .build());

        List<CommentResponse> comments = commentService.listComments("p1", null);

        assertThat(comments).singleElement()
                .extracting(CommentResponse::getUsername)
                .isEqualTo(CommentResponse.UNKNOWN_AUTHOR);
    }

    @Test
    @DisplayName("Text must be between 1 and 2000 characters")
    void testTextLength() {
        User alice = createUser("alice");

        assertThatThrownBy(() -> commentService.createComment("p1", alice, ""))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> commentService.createComment("p1", alice, "x".repeat(2001)))
                .isInstanceOf(ValidationException.class);

        CommentResponse longest = commentService.createComment("p1", alice, "x".repeat(2000));
        assertThat(longest.getText()).hasSize(2000);
    }

    @Test
    @DisplayName("Text length counts characters, not UTF-16 units")
    void testTextLengthCountsCodePoints() {
        User alice = createUser("alice");

        CommentResponse emoji = commentService.createComment("p1", alice, "😀".repeat(2000));
        assertThat(emoji.getText()).isEqualTo("😀".repeat(2000));
        assertThat(commentService.listComments("p1", null)).singleElement()
                .extracting(CommentResponse::getText)
                .isEqualTo("😀".repeat(2000));

        assertThatThrownBy(() -> commentService.createComment("p1", alice, "😀".repeat(2001)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Only the author can delete a comment")
    void testDeleteByNonAuthorForbidden() {
        User alice = createUser("alice");
        User bob = createUser("bob");
        CommentResponse created = commentService.createComment("p1", alice, "hi");

        assertThatThrownBy(() -> commentService.deleteComment(created.getId(), bob.getUserId()))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessage("You can only delete your own comments");

        assertThat(commentService.listComments("p1", null)).hasSize(1);
    }

    @Test
    @DisplayName("Author deletes a comment and it leaves the list")
    void testDeleteByAuthor() {
        User alice = createUser("alice");
        CommentResponse created = commentService.createComment("p1", alice, "hi");

        commentService.deleteComment(created.getId(), alice.getUserId());

        assertThat(commentService.listComments("p1", alice.getUserId())).isEmpty();
        assertThatThrownBy(() -> commentService.deleteComment(created.getId(), alice.getUserId()))
                .isInstanceOf(CommentNotFoundException.class);
    }

    @Test
    @DisplayName("Unknown or unparseable ids are not found, whoever asks")
    void testDeleteNotFound() {
        User alice = createUser("alice");

        assertThatThrownBy(() -> commentService.deleteComment("999999", alice.getUserId()))
                .isInstanceOf(CommentNotFoundException.class)
                .hasMessage("Comment not found");
        assertThatThrownBy(() -> commentService.deleteComment("not-an-id", alice.getUserId()))
                .isInstanceOf(CommentNotFoundException.class);
    }
}
