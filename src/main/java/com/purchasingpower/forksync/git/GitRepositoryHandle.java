package com.purchasingpower.forksync.git;

import com.purchasingpower.forksync.exception.FetchException;
import com.purchasingpower.forksync.exception.ForkSyncException;
import com.purchasingpower.forksync.model.ChangedFile;
import com.purchasingpower.forksync.model.ChangedFile.ChangeType;
import com.purchasingpower.forksync.model.UpstreamCommit;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.RenameDetector;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.transport.TagOpt;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Explicit handle on one repository and its working tree.
 *
 * <p>Every step of a sync run receives this handle instead of relying on a current
 * directory or globally configured merge drivers. All JGit failures are wrapped into
 * {@link ForkSyncException} here, so callers only deal with the engine's own hierarchy.
 */
@Slf4j
public class GitRepositoryHandle implements AutoCloseable {

    private final Git git;
    private final Repository repository;

    public GitRepositoryHandle(Git git) {
        this.git = git;
        this.repository = git.getRepository();
    }

    public static GitRepositoryHandle open(File workTree) {
        try {
            return new GitRepositoryHandle(Git.open(workTree));
        } catch (IOException e) {
            throw new ForkSyncException("Not a git repository: " + workTree.getAbsolutePath(), e);
        }
    }

    public Path workTree() {
        return repository.getWorkTree().toPath();
    }

    public Path gitDir() {
        return repository.getDirectory().toPath();
    }

    // ================================================================
    // REFS AND BRANCHES
    // ================================================================

    public String currentBranch() {
        try {
            return repository.getBranch();
        } catch (IOException e) {
            throw new ForkSyncException("Failed to read current branch", e);
        }
    }

    /**
     * Resolve a revision string, returning empty when it does not exist.
     */
    public Optional<ObjectId> resolve(String revision) {
        try {
            return Optional.ofNullable(repository.resolve(revision));
        } catch (IOException e) {
            throw new ForkSyncException("Failed to resolve " + revision, e);
        }
    }

    public ObjectId require(String revision) {
        return resolve(revision)
                .orElseThrow(() -> new ForkSyncException("Revision not found: " + revision));
    }

    public boolean branchExists(String branchName) {
        try {
            return repository.exactRef(Constants.R_HEADS + branchName) != null;
        } catch (IOException e) {
            throw new ForkSyncException("Failed to look up branch " + branchName, e);
        }
    }

    public void createBranch(String branchName, ObjectId startPoint) {
        try {
            git.branchCreate()
                    .setName(branchName)
                    .setStartPoint(startPoint.getName())
                    .call();
            log.debug("Created branch {} at {}", branchName, abbreviate(startPoint));
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to create branch " + branchName, e);
        }
    }

    public void checkout(String branchName) {
        try {
            git.checkout().setName(branchName).call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to check out " + branchName, e);
        }
    }

    public void createAndCheckoutBranch(String branchName, ObjectId startPoint) {
        try {
            git.checkout()
                    .setCreateBranch(true)
                    .setName(branchName)
                    .setStartPoint(startPoint.getName())
                    .call();
            log.info("Created and switched to {}", branchName);
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to create branch " + branchName, e);
        }
    }

    public void deleteBranch(String branchName) {
        try {
            git.branchDelete().setBranchNames(branchName).setForce(true).call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to delete branch " + branchName, e);
        }
    }

    // ================================================================
    // REMOTES
    // ================================================================

    public boolean hasRemote(String remoteName) {
        try {
            return git.remoteList().call().stream()
                    .anyMatch(remote -> remote.getName().equals(remoteName));
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to list remotes", e);
        }
    }

    public void addRemote(String remoteName, String url) {
        try {
            git.remoteAdd().setName(remoteName).setUri(new URIish(url)).call();
            log.info("Added remote {} -> {}", remoteName, url);
        } catch (URISyntaxException | GitAPIException e) {
            throw new ForkSyncException("Failed to add remote " + remoteName, e);
        }
    }

    /**
     * Fetch a remote including tags. The only network call of a run; never retried.
     */
    public void fetch(String remoteName) {
        try {
            git.fetch()
                    .setRemote(remoteName)
                    .setTagOpt(TagOpt.FETCH_TAGS)
                    .call();
        } catch (GitAPIException | JGitInternalException e) {
            throw new FetchException("Could not fetch remote '" + remoteName + "': " + e.getMessage(), e);
        }
    }

    // ================================================================
    // HISTORY
    // ================================================================

    /**
     * Number of commits reachable from {@code include} but not from {@code exclude}.
     */
    public int countCommits(ObjectId include, ObjectId exclude) {
        return listCommits(include, exclude, Integer.MAX_VALUE).size();
    }

    /**
     * Commits reachable from {@code include} but not from {@code exclude}, newest first.
     */
    public List<UpstreamCommit> listCommits(ObjectId include, ObjectId exclude, int limit) {
        List<UpstreamCommit> commits = new ArrayList<>();
        try (RevWalk walk = new RevWalk(repository)) {
            walk.markStart(walk.parseCommit(include));
            walk.markUninteresting(walk.parseCommit(exclude));
            for (RevCommit commit : walk) {
                if (commits.size() >= limit) {
                    break;
                }
                commits.add(new UpstreamCommit(
                        commit.getName(),
                        commit.getShortMessage(),
                        commit.getAuthorIdent().getName(),
                        Instant.ofEpochSecond(commit.getCommitTime())));
            }
            return commits;
        } catch (IOException e) {
            throw new ForkSyncException("Failed to walk history", e);
        }
    }

    public Optional<ObjectId> mergeBase(ObjectId a, ObjectId b) {
        try (RevWalk walk = new RevWalk(repository)) {
            walk.setRevFilter(RevFilter.MERGE_BASE);
            walk.markStart(walk.parseCommit(a));
            walk.markStart(walk.parseCommit(b));
            RevCommit base = walk.next();
            return Optional.ofNullable(base).map(RevCommit::toObjectId);
        } catch (IOException e) {
            throw new ForkSyncException("Failed to compute merge base", e);
        }
    }

    /**
     * Files changed between two commits, with rename detection. A rename reports its source path
     * as a deletion next to the new path.
     *
     * @param fromCommit older side, or null to diff against the empty tree
     * @param toCommit   newer side
     */
    public List<ChangedFile> diff(ObjectId fromCommit, ObjectId toCommit) {
        try {
            AbstractTreeIterator oldTree = fromCommit == null
                    ? new EmptyTreeIterator()
                    : prepareTreeParser(fromCommit);
            AbstractTreeIterator newTree = prepareTreeParser(toCommit);

            List<DiffEntry> entries = git.diff()
                    .setOldTree(oldTree)
                    .setNewTree(newTree)
                    .setShowNameAndStatusOnly(true)
                    .call();

            RenameDetector renames = new RenameDetector(repository);
            renames.addAll(entries);

            List<ChangedFile> changed = new ArrayList<>();
            for (DiffEntry entry : renames.compute()) {
                if (entry.getChangeType() == DiffEntry.ChangeType.RENAME) {
                    changed.add(new ChangedFile(entry.getOldPath(), ChangeType.DELETE));
                }
                changed.add(toChangedFile(entry));
            }
            return changed;
        } catch (IOException | GitAPIException e) {
            throw new ForkSyncException("Failed to compute diff", e);
        }
    }

    // ================================================================
    // OBJECT ACCESS
    // ================================================================

    /**
     * Blob id of {@code path} in the tree of {@code commitId}, empty when absent.
     */
    public Optional<ObjectId> blobId(ObjectId commitId, String path) {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(commitId);
            try (TreeWalk treeWalk = TreeWalk.forPath(repository, path, commit.getTree())) {
                if (treeWalk == null || treeWalk.isSubtree()) {
                    return Optional.empty();
                }
                return Optional.of(treeWalk.getObjectId(0));
            }
        } catch (IOException e) {
            throw new ForkSyncException("Failed to look up " + path, e);
        }
    }

    public long blobSize(ObjectId blobId) {
        try (ObjectReader reader = repository.newObjectReader()) {
            return reader.getObjectSize(blobId, Constants.OBJ_BLOB);
        } catch (IOException e) {
            throw new ForkSyncException("Failed to read blob " + abbreviate(blobId), e);
        }
    }

    public byte[] readBlob(ObjectId blobId) {
        try {
            ObjectLoader loader = repository.open(blobId, Constants.OBJ_BLOB);
            try (InputStream in = loader.openStream()) {
                return in.readAllBytes();
            }
        } catch (IOException e) {
            throw new ForkSyncException("Failed to read blob " + abbreviate(blobId), e);
        }
    }

    public Optional<byte[]> readFile(ObjectId commitId, String path) {
        return blobId(commitId, path).map(this::readBlob);
    }

    // ================================================================
    // WORKING TREE AND INDEX
    // ================================================================

    public Status status() {
        try {
            return git.status().call();
        } catch (GitAPIException | JGitInternalException e) {
            throw new ForkSyncException("Failed to read status", e);
        }
    }

    /**
     * Tracked paths with uncommitted changes. Untracked files are ignored.
     */
    public Set<String> uncommittedPaths() {
        return new TreeSet<>(status().getUncommittedChanges());
    }

    public Set<String> conflictingPaths() {
        return new TreeSet<>(status().getConflicting());
    }

    /**
     * Paths whose index entry differs from HEAD.
     */
    public Set<String> stagedPaths() {
        Status status = status();
        Set<String> staged = new TreeSet<>();
        staged.addAll(status.getAdded());
        staged.addAll(status.getChanged());
        staged.addAll(status.getRemoved());
        return staged;
    }

    /**
     * Distinct index paths under a directory, including conflicted entries.
     */
    public Set<String> indexPathsUnder(String directory) {
        String prefix = directory.endsWith("/") ? directory : directory + "/";
        try {
            DirCache dirCache = repository.readDirCache();
            Set<String> paths = new LinkedHashSet<>();
            for (int i = 0; i < dirCache.getEntryCount(); i++) {
                String path = dirCache.getEntry(i).getPathString();
                if (path.startsWith(prefix)) {
                    paths.add(path);
                }
            }
            return paths;
        } catch (IOException e) {
            throw new ForkSyncException("Failed to read index", e);
        }
    }

    public void writeWorkTreeFile(String path, byte[] content) {
        Path file = workTree().resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content);
        } catch (IOException e) {
            throw new ForkSyncException("Failed to write " + path, e);
        }
    }

    public void stage(String pathOrDirectory) {
        try {
            git.add().addFilepattern(pathOrDirectory).call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to stage " + pathOrDirectory, e);
        }
    }

    /**
     * Remove a path from the index, and from the working tree unless {@code cachedOnly}.
     */
    public void remove(String path, boolean cachedOnly) {
        try {
            git.rm().setCached(cachedOnly).addFilepattern(path).call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Failed to remove " + path, e);
        }
    }

    /**
     * Reset index and working tree of a path (file or directory) to HEAD.
     * Files under the path that HEAD does not know are deleted.
     */
    public void restoreFromHead(String path) {
        try {
            git.reset().setRef(Constants.HEAD).addPath(path).call();

            Path target = workTree().resolve(path);
            if (Files.isDirectory(target)) {
                FileSystemUtils.deleteRecursively(target);
            } else {
                Files.deleteIfExists(target);
            }

            ObjectId head = require(Constants.HEAD);
            if (pathExistsInCommit(head, path)) {
                git.checkout().setStartPoint(head.getName()).addPath(path).call();
            }
        } catch (IOException | GitAPIException e) {
            throw new ForkSyncException("Failed to restore " + path + " from HEAD", e);
        }
    }

    // ================================================================
    // MERGE AND COMMIT
    // ================================================================

    /**
     * Three-way merge without committing and without fast-forward.
     */
    public MergeResult mergeNoCommit(ObjectId upstream, String upstreamName) {
        try {
            return git.merge()
                    .include(upstreamName, upstream)
                    .setCommit(false)
                    .setFastForward(MergeCommand.FastForwardMode.NO_FF)
                    .call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Merge of " + upstreamName + " failed", e);
        }
    }

    public MergeResult fastForward(String branchName) {
        try {
            return git.merge()
                    .include(require(Constants.R_HEADS + branchName))
                    .setFastForward(MergeCommand.FastForwardMode.FF_ONLY)
                    .call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Fast-forward to " + branchName + " failed", e);
        }
    }

    public RevCommit commit(String message) {
        try {
            return git.commit().setMessage(message).call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Commit failed", e);
        }
    }

    public void resetHard(String revision) {
        try {
            git.reset().setMode(ResetCommand.ResetType.HARD).setRef(revision).call();
        } catch (GitAPIException e) {
            throw new ForkSyncException("Hard reset to " + revision + " failed", e);
        }
    }

    @Override
    public void close() {
        git.close();
    }

    // ================================================================
    // HELPER METHODS
    // ================================================================

    private boolean pathExistsInCommit(ObjectId commitId, String path) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(commitId);
            try (TreeWalk treeWalk = TreeWalk.forPath(repository, path, commit.getTree())) {
                return treeWalk != null;
            }
        }
    }

    private AbstractTreeIterator prepareTreeParser(ObjectId commitId) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(commitId);
            CanonicalTreeParser treeParser = new CanonicalTreeParser();
            try (ObjectReader reader = repository.newObjectReader()) {
                treeParser.reset(reader, commit.getTree().getId());
            }
            return treeParser;
        }
    }

    private static ChangedFile toChangedFile(DiffEntry entry) {
        return switch (entry.getChangeType()) {
            case ADD -> new ChangedFile(entry.getNewPath(), ChangeType.ADD);
            case MODIFY -> new ChangedFile(entry.getNewPath(), ChangeType.MODIFY);
            case DELETE -> new ChangedFile(entry.getOldPath(), ChangeType.DELETE);
            case RENAME -> new ChangedFile(entry.getNewPath(), ChangeType.RENAME);
            case COPY -> new ChangedFile(entry.getNewPath(), ChangeType.COPY);
        };
    }

    static String abbreviate(ObjectId id) {
        return id == null ? "(none)" : id.getName().substring(0, 8);
    }
}
