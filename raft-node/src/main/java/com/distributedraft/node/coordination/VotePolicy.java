package com.distributedraft.node.coordination;

/**
 * Rule used to decide a RequestVote once the request's term is not stale.
 */
public enum VotePolicy {

    /**
     * Grant only while this node's vote for the current term designates itself.
     * The requesting candidate's identity and log are not looked at.
     */
    SELF_AFFIRMING,

    /**
     * Grant to the first candidate asking in a term (or to a repeated request from it)
     * whose log is at least as up-to-date as ours, and record that vote.
     */
    CANONICAL
}
