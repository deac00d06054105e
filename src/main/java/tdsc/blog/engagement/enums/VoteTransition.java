package tdsc.blog.engagement.enums;

/**
 * Outcome of submitting a vote for a (user, post) pair
 */
public enum VoteTransition {
    /**
     * No previous vote, a new one was stored
     */
    INSERTED,

    /**
     * Same kind resubmitted, the vote was toggled off
     */
    REMOVED,

    /**
     * Opposite kind submitted, the vote was flipped in place
     */
    CHANGED
}
