package com.stamp.analysis.datasource;

import java.io.File;

/** Opens a file as a container of some type. Lets format readers be exercised without binary fixture files. */
@FunctionalInterface
public interface ContainerOpener<C extends AutoCloseable> {

    C open (File file) throws Exception;

}
