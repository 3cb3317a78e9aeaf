package com.cred.freestyle.salesdata.seed;

import com.cred.freestyle.salesdata.config.SalesDataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Keeps a 1x1 PNG under the media root that seeded products point at when they have no image.
 *
 * @author Sales Data Team
 */
@Component
public class PlaceholderImageStore {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderImageStore.class);

    static final byte[] PLACEHOLDER_PNG = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n',
            0x00, 0x00, 0x00, 0x0d, 'I', 'H', 'D', 'R',
            0x00, 0x00, 0x00, 0x01, 0x00, 0x00, 0x00, 0x01,
            0x08, 0x02, 0x00, 0x00, 0x00, (byte) 0x90, 'w', 'S', (byte) 0xde,
            0x00, 0x00, 0x00, 0x0a, 'I', 'D', 'A', 'T',
            'x', (byte) 0x9c, 'c', '`', '`', '`', 0x00, 0x00, 0x00, 0x02, 0x00, 0x01,
            (byte) 0xe2, '!', (byte) 0xbc, 0x33,
            0x00, 0x00, 0x00, 0x00, 'I', 'E', 'N', 'D', (byte) 0xae, 'B', '`', (byte) 0x82
    };

    private final Path mediaRoot;
    private final String relativePath;

    public PlaceholderImageStore(SalesDataProperties properties) {
        this.mediaRoot = Paths.get(properties.getMedia().getRoot());
        this.relativePath = properties.getMedia().getPlaceholderPath();
    }

    /**
     * Path stored on products, relative to the media root.
     */
    public String getRelativePath() {
        return relativePath;
    }

    /**
     * Write the placeholder file unless it already exists.
     * A failed write is logged and reported, never thrown.
     *
     * @return true if the file exists afterwards
     */
    public boolean ensurePlaceholder() {
        Path target = mediaRoot.resolve(relativePath);
        try {
            if (Files.exists(target)) {
                return true;
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, PLACEHOLDER_PNG);
            logger.info("Wrote placeholder product image to {}", target);
            return true;
        } catch (IOException | SecurityException e) {
            logger.warn("Could not write placeholder product image to {}: {}", target, e.getMessage());
            return false;
        }
    }
}
