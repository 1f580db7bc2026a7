package com.lbg.markets.surveillance.courier.source;

import com.lbg.markets.surveillance.courier.domain.FileDescriptor;

import java.nio.file.Path;
import java.util.List;

public interface SourceProvider {
    /**
     * Every regular file under the given roots, in enumeration order.
     */
    List<FileDescriptor> list(List<Path> roots);
}
