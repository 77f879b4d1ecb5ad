package com.invertedindex.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 将命令行给出的文件或目录展开为待索引的文件列表。
 */
public final class DocumentSources {
    private DocumentSources() {
    }

    /**
     * 目录只展开其直接子级中的普通文件（按文件名排序），普通文件原样保留。
     *
     * @param inputs 文件或目录
     * @return 按输入顺序展开后的文件列表
     * @throws DocumentReadException 路径不存在或目录无法列出时抛出
     */
    public static List<Path> expand(List<Path> inputs) throws DocumentReadException {
        if (inputs == null) {
            throw new IllegalArgumentException("输入路径列表不能为空");
        }
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                files.addAll(listRegularFiles(input));
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new DocumentReadException(input, "路径不存在或不是普通文件");
            }
        }
        return files;
    }

    private static List<Path> listRegularFiles(Path directory) throws DocumentReadException {
        try (Stream<Path> children = Files.list(directory)) {
            return children
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        } catch (IOException exception) {
            throw new DocumentReadException(directory, exception);
        }
    }
}
