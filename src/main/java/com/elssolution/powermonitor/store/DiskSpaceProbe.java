package com.elssolution.powermonitor.store;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/** Free/total space of the volume the store lives on. */
public interface DiskSpaceProbe {

    long freeBytes();

    long totalBytes();

    /** Probe backed by the {@link FileStore} holding {@code path}. */
    static DiskSpaceProbe forPath(Path path) {
        return new DiskSpaceProbe() {
            @Override
            public long freeBytes() {
                try {
                    return fileStore().getUsableSpace();
                } catch (IOException e) {
                    throw new StoreException("Cannot read free space of " + path, e);
                }
            }

            @Override
            public long totalBytes() {
                try {
                    return fileStore().getTotalSpace();
                } catch (IOException e) {
                    throw new StoreException("Cannot read total space of " + path, e);
                }
            }

            private FileStore fileStore() throws IOException {
                Path probe = Files.exists(path) ? path : path.toAbsolutePath().getParent();
                return Files.getFileStore(probe);
            }
        };
    }
}
