package io.lighting.renamer.context;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 单个文件的求值上下文。image/file/size 的实现应当延迟加载，并且每个实例最多加载一次。
 */
public interface EvaluationContext {
    String name();

    String ext();

    String fullName();

    String fullPath();

    String dirName();

    int index();

    int totalCount();

    LocalDate today();

    LocalDateTime now();

    ImageDimensions image();

    FileMetadata file();

    long size();

    default int reverseIndex() {
        int total = totalCount();
        return total > 0 ? total - 1 - index() : 0;
    }
}
