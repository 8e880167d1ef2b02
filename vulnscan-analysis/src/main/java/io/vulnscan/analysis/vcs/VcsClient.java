package io.vulnscan.analysis.vcs;

/**
 * Obtains a local tree for a remote repository.
 */
public interface VcsClient {

    /**
     * Clones (or refreshes a cached clone of) a repository.
     *
     * @param branch branch to check out, or null for the remote default
     * @throws io.vulnscan.PermanentInputException with NOT_FOUND, AUTH_REQUIRED or INVALID_INPUT
     * @throws io.vulnscan.TransientProviderException with NETWORK for connectivity failures
     */
    WorkingCopy checkout(String url, String branch);

    /**
     * Deletes a disposable working copy. Non-disposable copies are left alone.
     */
    void release(WorkingCopy copy);
}
