package tdsc.blog.engagement.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import tdsc.blog.engagement.domain.Vote;
import tdsc.blog.engagement.enums.VoteType;

import java.time.LocalDateTime;

/**
 * MyBatis mapper for the votes table.
 * The table carries a unique constraint on (user_id, post_slug).
 */
@Mapper
public interface VoteMapper {

    /**
     * Insert a new vote
     * @throws org.springframework.dao.DuplicateKeyException if the user already voted on the post
     */
    int insert(Vote vote);

    /**
     * Find the vote a user cast on a post
     * @return the vote, or null if none
     */
    Vote findByUserAndSlug(@Param("userId") Long userId, @Param("postSlug") String postSlug);

    /**
     * Flip an existing vote in place
     * @return number of rows affected
     */
    int updateVoteType(@Param("voteId") Long voteId,
                       @Param("voteType") VoteType voteType,
                       @Param("updatedAt") LocalDateTime updatedAt);

    int deleteById(@Param("voteId") Long voteId);

    /**
     * Count votes of one kind on a post, across all users
     */
    long countBySlugAndType(@Param("postSlug") String postSlug, @Param("voteType") VoteType voteType);
}
