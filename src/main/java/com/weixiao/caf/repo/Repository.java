package com.weixiao.caf.repo;

import com.weixiao.caf.diff.DiffSource;
import com.weixiao.caf.diff.TreeDiff;
import com.weixiao.caf.diff.TreeDiffer;
import com.weixiao.caf.diff.TreeLookup;
import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.errors.ConflictException;
import com.weixiao.caf.errors.InvalidReferenceException;
import com.weixiao.caf.errors.MergeInProgressException;
import com.weixiao.caf.errors.NotFoundException;
import com.weixiao.caf.errors.RepositoryNotFoundException;
import com.weixiao.caf.obj.Blob;
import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.ref.Ref;
import com.weixiao.caf.ref.SymRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 仓库：工作目录 + 元数据目录（默认 .caf），提供 ObjectDatabase、Refs、Workspace、TreeBuilder，
 * 以及分支、标签、提交、log、diff、合并状态等仓库级操作。
 * <p>
 * 需要已初始化仓库的操作都会先调用 {@link #requireRepository()}，仓库不存在时统一抛 {@link RepositoryNotFoundException}。
 * 写入顺序总是先对象后 ref：ref 只会指向已经完整写入的对象。
 */
public final class Repository {

    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    private final Path workingDir;
    private final Path repoDir;
    private final RepositoryConfig config;
    private final ObjectCodec codec;
    private final ObjectDatabase database;
    private final Refs refs;
    private final Workspace workspace;
    private final TreeBuilder treeBuilder;

    /**
     * 使用默认布局（.caf）。仓库在 {@link #init()} 之前不会在磁盘上创建。
     */
    public Repository(Path workingDir) {
        this(workingDir, RepositoryConfig.defaults());
    }

    public Repository(Path workingDir, RepositoryConfig config) {
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.config = config;
        this.repoDir = this.workingDir.resolve(config.getRepoDirName());
        this.codec = new ObjectCodec(config.getHashLength());
        this.database = new ObjectDatabase(repoDir.resolve(config.getObjectsDir()), codec);
        this.refs = new Refs(repoDir, config);
        this.workspace = new Workspace(this.workingDir, config.getRepoDirName());
        this.treeBuilder = new TreeBuilder(codec, workspace);
    }

    /**
     * 从 start 向上查找包含元数据目录的目录作为工作目录；未找到返回 null。
     */
    public static Repository find(Path start, RepositoryConfig config) {
        Path current = start.toAbsolutePath().normalize();
        log.debug("find repo start={} repoDir={}", current, config.getRepoDirName());
        while (current != null) {
            if (Files.isDirectory(current.resolve(config.getRepoDirName()))) {
                log.debug("found repo at {}", current);
                return new Repository(current, config);
            }
            current = current.getParent();
        }
        log.debug("no repo found");
        return null;
    }

    public static Repository find(Path start) {
        return find(start, RepositoryConfig.defaults());
    }

    /** 以默认分支初始化。 */
    public void init() throws IOException {
        init(config.getDefaultBranch());
    }

    /**
     * 创建 objects、refs/heads、refs/tags，未出生的默认分支，以及指向它的 HEAD。
     *
     * @throws ConflictException        仓库已存在
     * @throws IllegalArgumentException 工作目录不是目录，或分支名为空
     */
    public void init(String defaultBranch) throws IOException {
        if (defaultBranch == null || defaultBranch.isEmpty()) {
            throw new IllegalArgumentException("Branch name is required");
        }
        if (!Refs.isSafeName(defaultBranch)) {
            throw new IllegalArgumentException("Invalid branch name: " + defaultBranch);
        }
        if (!Files.isDirectory(workingDir)) {
            throw new IllegalArgumentException(workingDir + " is not a directory");
        }
        if (exists()) {
            throw new ConflictException("Repository already exists at " + repoDir);
        }
        Files.createDirectories(database.getObjectsDir());
        Files.createDirectories(refs.getHeadsDir());
        Files.createDirectories(refs.getTagsDir());
        refs.writeRef(refs.branchFile(defaultBranch), null);
        refs.writeHead(SymRef.branch(defaultBranch));
        log.info("initialized repository at {} on branch {}", repoDir, defaultBranch);
    }

    public boolean exists() {
        return Files.isDirectory(repoDir);
    }

    /**
     * 仓库存在性检查，所有需要仓库的操作先调用它。
     *
     * @throws RepositoryNotFoundException 仓库未初始化
     */
    public void requireRepository() throws RepositoryNotFoundException {
        if (!exists()) {
            throw new RepositoryNotFoundException(repoDir);
        }
    }

    /** 删除整个元数据目录（对象、ref、合并标记），工作目录文件不动。 */
    public void delete() throws IOException {
        requireRepository();
        try (Stream<Path> stream = Files.walk(repoDir)) {
            for (Path p : stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        }
        log.info("deleted repository at {}", repoDir);
    }

    /** HEAD 的值。 */
    public Ref headRef() throws IOException {
        requireRepository();
        return refs.readHead();
    }

    /** HEAD 最终指向的 commit；未出生分支返回 null。 */
    public HashRef headCommit() throws IOException {
        return resolveRef(headRef());
    }

    /** HEAD 指向的分支名；分离 HEAD 返回 null。 */
    public String currentBranch() throws IOException {
        Ref head = headRef();
        return head instanceof SymRef ? ((SymRef) head).branchName() : null;
    }

    public HashRef resolveRef(Ref ref) throws IOException {
        requireRepository();
        return refs.resolve(ref);
    }

    /**
     * 解析字符串：HEAD、ref 名优先，其次是合法 oid。
     *
     * @throws InvalidReferenceException 既不是 ref 也不是 oid
     */
    public HashRef resolveRef(String name) throws IOException {
        requireRepository();
        return refs.resolve(name);
    }

    /** refs 下全部 ref。 */
    public List<SymRef> refs() throws IOException {
        requireRepository();
        return refs.refs();
    }

    /**
     * 更新已存在的 ref。
     *
     * @throws NotFoundException ref 不存在
     */
    public void updateRef(String name, Ref newRef) throws IOException {
        requireRepository();
        refs.updateRef(name, newRef);
    }

    /**
     * 新建未出生的分支（空 ref 文件）。
     *
     * @throws IllegalArgumentException 分支名为空或非法
     * @throws ConflictException        分支已存在，或与标签同名
     */
    public void addBranch(String branch) throws IOException {
        requireRepository();
        checkName(branch, "Branch");
        if (refs.branchExists(branch)) {
            throw new ConflictException("Branch \"" + branch + "\" already exists");
        }
        if (refs.tagExists(branch)) {
            throw new ConflictException("Branch \"" + branch + "\" conflicts with an existing tag");
        }
        refs.writeRef(refs.branchFile(branch), null);
        log.info("branch {} created", branch);
    }

    /**
     * 删除分支。
     *
     * @throws NotFoundException        分支不存在
     * @throws IllegalArgumentException 这是最后一个分支
     * @throws ConflictException        这是当前检出的分支
     */
    public void deleteBranch(String branch) throws IOException {
        requireRepository();
        checkName(branch, "Branch");
        if (!refs.branchExists(branch)) {
            throw new NotFoundException("Branch \"" + branch + "\" does not exist.");
        }
        if (refs.branches().size() == 1) {
            throw new IllegalArgumentException("Cannot delete the last branch \"" + branch + "\".");
        }
        if (branch.equals(currentBranch())) {
            throw new ConflictException("Cannot delete the checked-out branch \"" + branch + "\".");
        }
        Files.delete(refs.branchFile(branch));
        log.info("branch {} deleted", branch);
    }

    public boolean branchExists(String branch) throws IOException {
        requireRepository();
        return branch != null && Refs.isSafeName(branch) && refs.branchExists(branch);
    }

    /** 分支名，已排序。 */
    public List<String> branches() throws IOException {
        requireRepository();
        return refs.branches();
    }

    /**
     * 创建标签，指向 target 解析得到的 commit。标签一经创建不再原地修改。
     *
     * @throws IllegalArgumentException 标签名为空或非法
     * @throws ConflictException        标签已存在，或与分支同名
     * @throws NotFoundException        target 指向的 commit 不存在
     */
    public void createTag(String tag, String target) throws IOException {
        requireRepository();
        checkName(tag, "Tag");
        if (refs.tagExists(tag)) {
            throw new ConflictException("Tag \"" + tag + "\" already exists");
        }
        if (refs.branchExists(tag)) {
            throw new ConflictException("A branch named \"" + tag + "\" already exists");
        }
        HashRef commit = refs.resolve(target);
        if (commit == null || !database.exists(commit.getHash())) {
            throw new NotFoundException("Commit \"" + target + "\" does not exist");
        }
        database.loadCommit(commit.getHash());
        refs.writeRef(refs.tagFile(tag), commit);
        log.info("tag {} created at {}", tag, commit);
    }

    /**
     * 删除标签。
     *
     * @throws NotFoundException 标签不存在
     */
    public void deleteTag(String tag) throws IOException {
        requireRepository();
        checkName(tag, "Tag");
        if (!refs.tagExists(tag)) {
            throw new NotFoundException("Tag \"" + tag + "\" does not exist");
        }
        Files.delete(refs.tagFile(tag));
        log.info("tag {} deleted", tag);
    }

    public boolean tagExists(String tag) throws IOException {
        requireRepository();
        return tag != null && Refs.isSafeName(tag) && refs.tagExists(tag);
    }

    /** 标签名，已排序。 */
    public List<String> tags() throws IOException {
        requireRepository();
        return refs.tags();
    }

    /**
     * 把文件内容存为 blob，返回 oid。
     *
     * @throws IllegalArgumentException 不是普通文件
     */
    public String saveFileContent(Path file) throws IOException {
        requireRepository();
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File " + file + " does not exist");
        }
        return database.store(new Blob(Files.readAllBytes(file)));
    }

    /** 计算文件作为 blob 的 oid，不写对象库。 */
    public String hashFile(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File " + file + " does not exist");
        }
        return codec.hashFile(file);
    }

    /**
     * 保存目录：先构建 tree（只算 hash），再依次写入 blob、子 tree，最后写根 tree。
     *
     * @throws IllegalArgumentException path 不是目录
     */
    public HashRef saveDir(Path path) throws IOException {
        requireRepository();
        TreeBuilder.BuildResult built = treeBuilder.build(path);
        for (Map.Entry<String, Path> blob : built.getBlobSources().entrySet()) {
            String oid = database.store(new Blob(Files.readAllBytes(blob.getValue())));
            if (!oid.equals(blob.getKey())) {
                throw new CafException("file changed while saving: " + blob.getValue());
            }
        }
        // subtrees 中子 tree 在父 tree 之前，根 tree 最后写入
        for (Tree tree : built.getSubtrees().values()) {
            database.store(tree);
        }
        log.debug("saved dir {} tree={}", path, built.getHash());
        return new HashRef(built.getHash());
    }

    /**
     * 提交工作目录：保存 tree，再保存 commit，最后更新 HEAD 指向的分支（分离 HEAD 时更新 HEAD 本身）。
     * 当前 HEAD commit（如果有）作为唯一的父提交。
     *
     * @throws IllegalArgumentException author 或 message 为空
     */
    public HashRef commitWorkingDir(String author, String message) throws IOException {
        requireRepository();
        if (author == null || author.isEmpty()) {
            throw new IllegalArgumentException("Author is required");
        }
        if (author.indexOf('\n') >= 0 || author.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Author must be a single line");
        }
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Commit message is required");
        }
        Ref head = headRef();
        HashRef parent = refs.resolve(head);

        HashRef tree = saveDir(workingDir);
        Commit commit = new Commit(tree.getHash(), author, message, Instant.now().getEpochSecond(),
                parent == null ? List.of() : List.of(parent.getHash()));
        HashRef commitRef = new HashRef(database.store(commit));

        moveHead(head, commitRef);
        log.info("commit created {} tree={} parent={}", commitRef, tree, parent);
        return commitRef;
    }

    /**
     * 把 HEAD 所在位置移到 commit：HEAD 为 SymRef 时更新它指向的 ref，否则直接改写 HEAD（分离状态）。
     */
    public void moveHead(Ref head, HashRef commit) throws IOException {
        requireRepository();
        if (head instanceof SymRef && !((SymRef) head).isHead()) {
            refs.updateRef(((SymRef) head).getName(), commit);
        } else {
            refs.writeHead(commit);
        }
    }

    /** 改写 HEAD。 */
    public void writeHead(Ref ref) throws IOException {
        requireRepository();
        refs.writeHead(ref);
    }

    /**
     * commit 的根 tree；commit 为 null（未出生分支）时返回空 tree。
     */
    public Tree treeOf(HashRef commit) throws IOException {
        if (commit == null) {
            return Tree.empty();
        }
        return database.loadTree(database.loadCommit(commit.getHash()).getTreeOid());
    }

    /** 从 HEAD 开始的 log。 */
    public LogWalk log() throws IOException {
        return log(null);
    }

    /**
     * 从 tip 开始沿第一父提交的 log；tip 为 null 时取 HEAD。
     */
    public LogWalk log(Ref tip) throws IOException {
        requireRepository();
        HashRef start = refs.resolve(tip != null ? tip : refs.readHead());
        return new LogWalk(database, start);
    }

    /** 工作目录快照：相对路径到 blob oid，不写对象库。 */
    public Map<String, String> workingDirSnapshot() throws IOException {
        requireRepository();
        return workspace.snapshot(codec);
    }

    /** HEAD 与工作目录的 diff。 */
    public TreeDiff diff() throws IOException {
        return diff(null, DiffSource.of(workingDir));
    }

    public TreeDiff diff(String source1, String source2) throws IOException {
        return diff(source1 == null ? null : DiffSource.of(source1), source2 == null ? null : DiffSource.of(source2));
    }

    /**
     * 比较两侧：目录、引用、名字（目录优先）或 oid；null 表示 HEAD。两侧相同时直接返回空 diff。
     * 目录一侧的子 tree 优先从内存中取，其余从对象库加载。
     *
     * @throws CafException 任一侧无法解析或加载，cause 为底层错误
     */
    public TreeDiff diff(DiffSource source1, DiffSource source2) throws IOException {
        requireRepository();
        DiffSource s1 = source1 != null ? source1 : DiffSource.of(refs.readHead());
        DiffSource s2 = source2 != null ? source2 : DiffSource.of(refs.readHead());
        if (s1.equals(s2)) {
            return TreeDiff.empty();
        }
        Side side1;
        Side side2;
        try {
            side1 = toSide(s1);
            side2 = toSide(s2);
        } catch (IOException e) {
            throw new CafException("Error loading commit or tree", e);
        }
        log.debug("diff {} -> {}", s1, s2);
        return new TreeDiffer(side1.lookup, side2.lookup).diff(side1.tree, side2.tree);
    }

    private Side toSide(DiffSource source) throws IOException {
        switch (source.getKind()) {
            case DIRECTORY:
                if (!Files.isDirectory(source.getDirectory())) {
                    throw new NotFoundException(source.getDirectory() + " is not a directory");
                }
                return directorySide(source.getDirectory());
            case NAME:
                Path dir = workingDir.resolve(source.getName());
                if (Files.isDirectory(dir)) {
                    return directorySide(dir);
                }
                return commitSide(refs.classify(source.getName()), source);
            default:
                return commitSide(source.getRef(), source);
        }
    }

    private Side directorySide(Path dir) throws IOException {
        TreeBuilder.BuildResult built = treeBuilder.build(dir);
        Map<String, Tree> inMemory = built.getSubtrees();
        TreeLookup lookup = hash -> {
            Tree tree = inMemory.get(hash);
            return tree != null ? tree : database.loadTree(hash);
        };
        return new Side(built.getTree(), lookup);
    }

    /** 未出生分支视为空 tree；无法解析的 HashRef/名字报错。 */
    private Side commitSide(Ref ref, DiffSource source) throws IOException {
        if (ref == null) {
            throw new InvalidReferenceException("Cannot resolve reference " + source);
        }
        HashRef commit = refs.resolve(ref);
        return new Side(treeOf(commit), database::loadTree);
    }

    private static final class Side {
        private final Tree tree;
        private final TreeLookup lookup;

        private Side(Tree tree, TreeLookup lookup) {
            this.tree = tree;
            this.lookup = lookup;
        }
    }

    /**
     * 进入合并进行中状态（创建合并标记目录）。
     *
     * @throws MergeInProgressException 已有合并在进行
     */
    public void startMerge() throws IOException {
        requireRepository();
        Path mergeDir = mergeDir();
        if (Files.exists(mergeDir)) {
            throw new MergeInProgressException();
        }
        Files.createDirectory(mergeDir);
        log.info("entered merge state");
    }

    public boolean isMerging() throws IOException {
        requireRepository();
        return Files.exists(mergeDir());
    }

    /**
     * 放弃合并：只删除合并标记，不改 HEAD 和分支。
     *
     * @throws NotFoundException 没有进行中的合并
     */
    public void abortMerge() throws IOException {
        requireRepository();
        Path mergeDir = mergeDir();
        if (!Files.exists(mergeDir)) {
            throw new NotFoundException("No merge in progress");
        }
        try (Stream<Path> stream = Files.walk(mergeDir)) {
            for (Path p : stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        }
        log.info("merge aborted");
    }

    private Path mergeDir() {
        return repoDir.resolve(config.getMergeDir());
    }

    private static void checkName(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(what + " name is required");
        }
        if (!Refs.isSafeName(name)) {
            throw new IllegalArgumentException("Invalid " + what.toLowerCase() + " name: " + name);
        }
    }

    /** 工作目录（工作区根）。 */
    public Path getWorkingDir() {
        return workingDir;
    }

    /** 元数据目录，如 &lt;work&gt;/.caf。 */
    public Path getRepoDir() {
        return repoDir;
    }

    public RepositoryConfig getConfig() {
        return config;
    }

    public ObjectCodec getCodec() {
        return codec;
    }

    /** 对象库，用于 store/load blob、tree、commit。 */
    public ObjectDatabase getDatabase() {
        return database;
    }

    public Refs getRefs() {
        return refs;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public TreeBuilder getTreeBuilder() {
        return treeBuilder;
    }
}
