package org.endlesssource.wcam.linux;

import org.endlesssource.wcam.api.Resolution;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the human readable output of {@code v4l2-ctl}.
 */
final class V4l2OutputParser {
    static final String UNNAMED = "Unnamed webcam";

    private static final Pattern BUS_SUFFIX = Pattern.compile("\\s*\\([^()]*\\)\\s*$");
    private static final Pattern DISCRETE_SIZE = Pattern.compile("Size:\\s+Discrete\\s+(\\d{1,9})x(\\d{1,9})");
    private static final Pattern STEPWISE_SIZE = Pattern.compile("Size:\\s+(?:Stepwise|Continuous)\\s+\\d+x\\d+\\s+-\\s+(\\d{1,9})x(\\d{1,9})");

    private V4l2OutputParser() {}

    /**
     * One block of {@code --list-devices}.
     *
     * @param name  card name without the bus suffix
     * @param nodes video nodes in listed order; media and subdevice nodes are dropped
     */
    record ListedDevice(String name, List<String> nodes) {
        ListedDevice {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * Blocks look like a non indented {@code Card name (bus info):} header followed by indented node paths.
     */
    static List<ListedDevice> parseDevices(String output) {
        List<ListedDevice> devices = new ArrayList<>();
        String name = null;
        List<String> nodes = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            if (!Character.isWhitespace(line.charAt(0))) {
                if (name != null) {
                    devices.add(new ListedDevice(name, nodes));
                }
                name = cardName(line.trim());
                nodes = new ArrayList<>();
            } else if (name != null) {
                String node = line.trim();
                if (node.substring(node.lastIndexOf('/') + 1).startsWith("video")) {
                    nodes.add(node);
                }
            }
        }
        if (name != null) {
            devices.add(new ListedDevice(name, nodes));
        }
        devices.removeIf(device -> device.nodes().isEmpty());
        return devices;
    }

    /**
     * Frame sizes of every pixel format, de-duplicated in listed order.
     * Stepwise and continuous ranges contribute their maximum size.
     */
    static List<Resolution> parseResolutions(String output) {
        Set<Resolution> sizes = new LinkedHashSet<>();
        for (String line : output.split("\\R")) {
            Matcher discrete = DISCRETE_SIZE.matcher(line);
            if (discrete.find()) {
                addSize(sizes, discrete.group(1), discrete.group(2));
                continue;
            }
            Matcher range = STEPWISE_SIZE.matcher(line);
            if (range.find()) {
                addSize(sizes, range.group(1), range.group(2));
            }
        }
        return List.copyOf(sizes);
    }

    private static String cardName(String header) {
        String name = header.endsWith(":") ? header.substring(0, header.length() - 1) : header;
        name = BUS_SUFFIX.matcher(name).replaceFirst("").trim();
        return name.isEmpty() ? UNNAMED : name;
    }

    private static void addSize(Set<Resolution> sizes, String width, String height) {
        int w = Integer.parseInt(width);
        int h = Integer.parseInt(height);
        if (w > 0 && h > 0) {
            sizes.add(new Resolution(w, h));
        }
    }
}
