package tdsc.blog.engagement.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tdsc.blog.engagement.config.OpenApiConfig;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.dto.VoteRequest;
import tdsc.blog.engagement.dto.VoteSummaryResponse;
import tdsc.blog.engagement.enums.VoteType;
import tdsc.blog.engagement.security.CurrentUser;
import tdsc.blog.engagement.service.VoteService;

/**
 * REST Controller for post votes
 */
@Slf4j
@RestController
@RequestMapping("/posts/{slug}/votes")
@Tag(name = "Votes", description = "Up/down votes on blog posts")
public class VoteController {

    @Autowired
    private VoteService voteService;

    /**
     * Vote counts for a post; includes the caller's own vote when a valid token is sent
     */
    @GetMapping
    @Operation(summary = "Get vote counts", description = "Bearer token optional")
    public VoteSummaryResponse getVotes(
            @Parameter(description = "Post slug", required = true) @PathVariable String slug,
            @Parameter(hidden = true) @CurrentUser(required = false) User caller) {
        return voteService.getVoteSummary(slug, caller != null ? caller.getUserId() : null);
    }

    /**
     * Submit, flip or toggle off the caller's vote
     *
     * @return the updated counts
     */
    @PostMapping
    @Operation(summary = "Submit a vote",
            description = "Same kind twice removes the vote; the opposite kind flips it",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public VoteSummaryResponse submitVote(
            @Parameter(description = "Post slug", required = true) @PathVariable String slug,
            @Parameter(hidden = true) @CurrentUser User caller,
            @RequestBody VoteRequest request) {
        log.info("Vote submission: slug={}, voteType={}, userId={}", slug, request.getVoteType(), caller.getUserId());
        VoteType voteType = VoteType.fromValue(request.getVoteType());
        voteService.submitVote(caller.getUserId(), slug, voteType);
        return voteService.getVoteSummary(slug, caller.getUserId());
    }
}
