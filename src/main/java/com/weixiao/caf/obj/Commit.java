package com.weixiao.caf.obj;

import lombok.Value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * commit 对象：tree、作者、提交信息、时间戳（秒）、有序的父提交列表。
 * 没有父提交表示根提交，多于一个父提交表示一次记录下来的合并。
 * 序列化格式：tree &lt;oid&gt;\n（parent &lt;oid&gt;\n）*author &lt;author&gt; &lt;timestamp&gt; +0000\n\nmessage
 */
@Value
public class Commit implements CafObject {

    public static final String TYPE = "commit";

    private static final String TIMEZONE = "+0000";

    String treeOid;
    String author;
    String message;
    long timestamp;
    List<String> parents;

    /**
     * 用 tree、作者、提交信息、时间戳与父提交构造 commit；parents 为 null 视为根提交，message 为 null 时当作空字符串。
     *
     * @throws IllegalArgumentException author 含换行（author 行无法再解析）
     */
    public Commit(String treeOid, String author, String message, long timestamp, List<String> parents) {
        if (author != null && (author.indexOf('\n') >= 0 || author.indexOf('\r') >= 0)) {
            throw new IllegalArgumentException("Author must be a single line");
        }
        this.treeOid = treeOid;
        this.author = author;
        this.message = message != null ? message : "";
        this.timestamp = timestamp;
        this.parents = parents != null ? List.copyOf(parents) : List.of();
    }

    /** 构造根提交（无 parent）。 */
    public static Commit root(String treeOid, String author, String message, long timestamp) {
        return new Commit(treeOid, author, message, timestamp, null);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    /** 第一个父提交，根提交返回 null。log 沿第一父提交回溯。 */
    public String getFirstParent() {
        return parents.isEmpty() ? null : parents.get(0);
    }

    /** 返回 commit 格式字节：tree、按顺序的 parent、author、空行、message。 */
    @Override
    public byte[] toBytes() {
        StringBuilder sb = new StringBuilder();
        sb.append("tree ").append(treeOid).append("\n");
        for (String parent : parents) {
            sb.append("parent ").append(parent).append("\n");
        }
        sb.append("author ").append(author).append(" ").append(timestamp).append(" ").append(TIMEZONE).append("\n");
        sb.append("\n");
        sb.append(message);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 解析 commit body。header 与 message 之间以第一个空行分隔。
     */
    public static Commit parse(byte[] body) throws IOException {
        String content = new String(body, StandardCharsets.UTF_8);
        int split = content.indexOf("\n\n");
        if (split < 0) {
            throw new IOException("invalid commit format: missing message separator");
        }
        String message = content.substring(split + 2);
        String treeOid = null;
        String author = null;
        long timestamp = 0;
        List<String> parents = new ArrayList<>();

        for (String line : content.substring(0, split).split("\n")) {
            if (line.startsWith("tree ")) {
                treeOid = line.substring(5).trim();
            } else if (line.startsWith("parent ")) {
                parents.add(line.substring(7).trim());
            } else if (line.startsWith("author ")) {
                // author 本身可以含空格：从右侧依次切出时区与时间戳
                String rest = line.substring(7);
                int tz = rest.lastIndexOf(' ');
                int ts = tz > 0 ? rest.lastIndexOf(' ', tz - 1) : -1;
                if (ts < 0) {
                    throw new IOException("invalid commit author line: " + line);
                }
                author = rest.substring(0, ts);
                if (author.indexOf('\r') >= 0) {
                    throw new IOException("invalid commit author line: " + line);
                }
                try {
                    timestamp = Long.parseLong(rest.substring(ts + 1, tz));
                } catch (NumberFormatException e) {
                    throw new IOException("invalid commit timestamp: " + line, e);
                }
            } else {
                throw new IOException("invalid commit header line: " + line);
            }
        }
        if (treeOid == null || author == null) {
            throw new IOException("invalid commit format: missing tree or author");
        }
        return new Commit(treeOid, author, message, timestamp, parents);
    }
}
