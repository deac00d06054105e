package tdsc.blog.engagement.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import tdsc.blog.engagement.domain.Vote;
import tdsc.blog.engagement.dto.VoteSummaryResponse;
import tdsc.blog.engagement.enums.VoteTransition;
import tdsc.blog.engagement.enums.VoteType;
import tdsc.blog.engagement.mapper.VoteMapper;

import java.time.LocalDateTime;

/**
 * Vote ledger: one vote per (user, post), toggled or flipped on resubmission.
 *
 * <pre>
 *   NoVote --submit(k)--> k          (insert)
 *   k      --submit(k)--> NoVote     (delete)
 *   k      --submit(!k)-> !k         (update in place)
 * </pre>
 *
 * The unique (user_id, post_slug) constraint is the source of truth. When two submits
 * for the same pair race, either the insert loses on the constraint or the update/delete
 * finds its row already gone; in both cases the read-modify-write is re-run once.
 */
@Slf4j
@Service
public class VoteService {

    @Autowired
    private VoteMapper voteMapper;

    @Autowired
    @Qualifier("voteRetryTemplate")
    private RetryTemplate voteRetryTemplate;

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Apply a vote submission for the caller
     *
     * @param userId   the voting user
     * @param postSlug the post key
     * @param voteType the submitted kind
     * @return which transition was applied
     */
    public VoteTransition submitVote(Long userId, String postSlug, VoteType voteType) {
        VoteTransition transition = voteRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying vote after concurrent change: userId={}, slug={}, cause={}",
                        userId, postSlug, String.valueOf(context.getLastThrowable()));
            }
            return applyVote(userId, postSlug, voteType);
        });

        meterRegistry.counter("blog.votes.submitted", "transition", transition.name()).increment();
        log.info("Vote submitted: userId={}, slug={}, voteType={}, transition={}",
                userId, postSlug, voteType.getValue(), transition);
        return transition;
    }

    private VoteTransition applyVote(Long userId, String postSlug, VoteType voteType) {
        Vote existing = voteMapper.findByUserAndSlug(userId, postSlug);
        LocalDateTime now = LocalDateTime.now();

        if (existing == null) {
            Vote vote = Vote.builder()
                    .userId(userId)
                    .postSlug(postSlug)
                    .voteType(voteType)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            voteMapper.insert(vote);
            log.debug("Vote inserted: voteId={}", vote.getVoteId());
            return VoteTransition.INSERTED;
        }

        if (existing.getVoteType() == voteType) {
            if (voteMapper.deleteById(existing.getVoteId()) == 0) {
                throw voteVanished(existing);
            }
            log.debug("Vote toggled off: voteId={}", existing.getVoteId());
            return VoteTransition.REMOVED;
        }

        if (voteMapper.updateVoteType(existing.getVoteId(), voteType, now) == 0) {
            throw voteVanished(existing);
        }
        log.debug("Vote changed: voteId={}, {} -> {}", existing.getVoteId(), existing.getVoteType(), voteType);
        return VoteTransition.CHANGED;
    }

    private static OptimisticLockingFailureException voteVanished(Vote stale) {
        return new OptimisticLockingFailureException("Vote " + stale.getVoteId()
                + " was removed by a concurrent submit");
    }

    /**
     * Vote counts for a post
     *
     * @param postSlug     the post key
     * @param callerUserId the caller, or null when anonymous
     * @return up and down counts across all users plus the caller's own vote, if any
     */
    public VoteSummaryResponse getVoteSummary(String postSlug, Long callerUserId) {
        long upvotes = voteMapper.countBySlugAndType(postSlug, VoteType.UP);
        long downvotes = voteMapper.countBySlugAndType(postSlug, VoteType.DOWN);

        VoteType userVote = null;
        if (callerUserId != null) {
            Vote own = voteMapper.findByUserAndSlug(callerUserId, postSlug);
            if (own != null) {
                userVote = own.getVoteType();
            }
        }

        return VoteSummaryResponse.builder()
                .upvotes(upvotes)
                .downvotes(downvotes)
                .userVote(userVote)
                .build();
    }
}
