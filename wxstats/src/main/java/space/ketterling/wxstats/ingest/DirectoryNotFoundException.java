package space.ketterling.wxstats.ingest;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The data directory given to an ingest run does not exist.
 */
public class DirectoryNotFoundException extends IOException {
    public DirectoryNotFoundException(Path dir) {
        super("Data directory not found: " + dir);
    }
}
