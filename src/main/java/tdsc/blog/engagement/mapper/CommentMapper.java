package tdsc.blog.engagement.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import tdsc.blog.engagement.domain.AuthoredComment;
import tdsc.blog.engagement.domain.Comment;

import java.util.List;

/**
 * MyBatis mapper for the comments table
 */
@Mapper
public interface CommentMapper {

    int insert(Comment comment);

    Comment findById(@Param("commentId") Long commentId);

    /**
     * Comments on a post joined with their author's username, newest first
     */
    List<AuthoredComment> findBySlugWithAuthor(@Param("postSlug") String postSlug);

    int deleteById(@Param("commentId") Long commentId);
}
