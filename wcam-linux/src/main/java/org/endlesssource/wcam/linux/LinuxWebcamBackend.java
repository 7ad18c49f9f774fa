package org.endlesssource.wcam.linux;

import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.api.WebcamInfo;
import org.endlesssource.wcam.spi.CaptureException;
import org.endlesssource.wcam.spi.CaptureSession;
import org.endlesssource.wcam.spi.WebcamBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Linux backend: enumerates V4L2 devices with {@code v4l2-ctl} and captures through FFmpeg.
 */
final class LinuxWebcamBackend implements WebcamBackend {
    private static final Logger logger = LoggerFactory.getLogger(LinuxWebcamBackend.class);
    static final Path BY_ID_DIRECTORY = Path.of("/dev/v4l/by-id");

    private final V4l2Ctl ctl;
    private final Path byIdDirectory;
    private final SessionOpener opener;
    // Probing formats spawns a process per node, so results are kept while the node stays listed.
    private final Map<ProbeKey, List<Resolution>> resolutionCache = new ConcurrentHashMap<>();
    private volatile Map<DeviceId, String> captureNodes = Map.of();

    LinuxWebcamBackend(V4l2Ctl ctl) {
        this(ctl, BY_ID_DIRECTORY, FFmpegCaptureSession::open);
    }

    LinuxWebcamBackend(V4l2Ctl ctl, Path byIdDirectory, SessionOpener opener) {
        this.ctl = Objects.requireNonNull(ctl, "ctl must not be null");
        this.byIdDirectory = Objects.requireNonNull(byIdDirectory, "byIdDirectory must not be null");
        this.opener = Objects.requireNonNull(opener, "opener must not be null");
    }

    @Override
    public List<WebcamInfo> enumerate() {
        List<V4l2OutputParser.ListedDevice> listed = V4l2OutputParser.parseDevices(ctl.listDevices());
        Map<Path, Path> links = readStableLinks();
        Set<ProbeKey> seen = new HashSet<>();
        Map<DeviceId, String> nodes = new LinkedHashMap<>();
        List<WebcamInfo> infos = new ArrayList<>();

        for (V4l2OutputParser.ListedDevice device : listed) {
            String captureNode = null;
            List<Resolution> resolutions = List.of();
            for (String node : device.nodes()) {
                ProbeKey key = new ProbeKey(device.name(), node);
                seen.add(key);
                resolutions = resolutionCache.computeIfAbsent(key,
                        k -> V4l2OutputParser.parseResolutions(ctl.listFormats(node)));
                if (!resolutions.isEmpty()) {
                    captureNode = node;
                    break;
                }
            }
            if (captureNode == null) {
                logger.debug("Skipping {}: no capture node reports a frame size", device.name());
                continue;
            }
            DeviceId id = deviceId(device.name(), captureNode, links);
            if (nodes.putIfAbsent(id, captureNode) != null) {
                logger.debug("Skipping {} on {}: id {} already listed", device.name(), captureNode, id);
                continue;
            }
            infos.add(new WebcamInfo(device.name(), id, resolutions));
        }

        resolutionCache.keySet().retainAll(seen);
        captureNodes = Map.copyOf(nodes);
        return infos;
    }

    @Override
    public CaptureSession open(DeviceId id, Resolution resolution) throws CaptureException {
        String node = captureNodes.get(id);
        if (node == null || !Files.exists(Path.of(node))) {
            throw new CaptureException(CaptureError.UNPLUGGED);
        }
        logger.debug("Opening {} ({}) at {}", id, node, resolution);
        return opener.open(id, node, resolution);
    }

    private DeviceId deviceId(String name, String node, Map<Path, Path> links) {
        Path link = links.get(realPath(Path.of(node)));
        return link != null ? DeviceId.of(link.toString()) : DeviceId.of(name);
    }

    /**
     * Maps each resolved device node to its first persistent {@code by-id} symlink.
     */
    private Map<Path, Path> readStableLinks() {
        if (!Files.isDirectory(byIdDirectory)) {
            return Map.of();
        }
        Map<Path, Path> links = new HashMap<>();
        try (Stream<Path> entries = Files.list(byIdDirectory)) {
            entries.sorted().forEach(link -> {
                try {
                    links.putIfAbsent(link.toRealPath(), link);
                } catch (IOException e) {
                    logger.debug("Ignoring dangling device link {}: {}", link, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", byIdDirectory, e.getMessage());
        }
        return links;
    }

    private static Path realPath(Path node) {
        try {
            return node.toRealPath();
        } catch (IOException e) {
            return node.toAbsolutePath().normalize();
        }
    }

    /**
     * Opens the capture of one node. Replaced in tests to avoid native FFmpeg.
     */
    @FunctionalInterface
    interface SessionOpener {
        CaptureSession open(DeviceId id, String node, Resolution resolution) throws CaptureException;
    }

    private record ProbeKey(String name, String node) {
    }
}
