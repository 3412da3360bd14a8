package com.weixiao.caf.diff;

import com.weixiao.caf.ref.Ref;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;

/**
 * diff 的一侧：目录、引用，或尚待解析的名字（目录路径、ref 名或 oid）。
 * 名字若指向存在的目录则按目录处理，优先于同名的 ref。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DiffSource {

    public enum Kind { DIRECTORY, REF, NAME }

    Kind kind;
    Path directory;
    Ref ref;
    String name;

    public static DiffSource of(Path directory) {
        return new DiffSource(Kind.DIRECTORY, directory.toAbsolutePath().normalize(), null, null);
    }

    public static DiffSource of(Ref ref) {
        return new DiffSource(Kind.REF, null, ref, null);
    }

    public static DiffSource of(String name) {
        return new DiffSource(Kind.NAME, null, null, name);
    }

    @Override
    public String toString() {
        switch (kind) {
            case DIRECTORY:
                return directory.toString();
            case REF:
                return String.valueOf(ref);
            default:
                return name;
        }
    }
}
