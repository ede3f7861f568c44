package com.chronicle.session;

import java.util.Optional;

public final class GitInfo {

    private static final GitInfo NONE = new GitInfo(null, null);

    private final String branch;
    private final String commit;

    public GitInfo(String branch, String commit) {
        this.branch = branch;
        this.commit = commit;
    }

    public static GitInfo none() {
        return NONE;
    }

    public Optional<String> getBranch() { return Optional.ofNullable(branch); }
    public Optional<String> getCommit() { return Optional.ofNullable(commit); }

    public boolean isRepository() {
        return branch != null || commit != null;
    }

    @Override
    public String toString() {
        return "GitInfo{branch=" + branch + ", commit=" + commit + "}";
    }
}
