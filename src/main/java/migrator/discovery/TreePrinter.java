package migrator.discovery;

import migrator.Util;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a {@link TreeSnapshot} as an indented outline sorted by name, with folders marked by a trailing separator.
 */
public class TreePrinter {
    private static final String INDENT = "  ";

    /**
     * Orders paths segment by segment, so every folder is immediately followed by its contents.
     */
    static final Comparator<String> BY_SEGMENTS = (a, b) -> {
        List<String> as = Arrays.asList(a.split(Util.PATH_SEPARATOR));
        List<String> bs = Arrays.asList(b.split(Util.PATH_SEPARATOR));
        for (int i = 0; i < Math.min(as.size(), bs.size()); i++) {
            int cmp = as.get(i).compareTo(bs.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(as.size(), bs.size());
    };

    /**
     * @param snapshot  The tree to render.
     * @param rootName  Name to print for the root folder.
     * @return          One line per folder and file, indented by depth.
     */
    public String render(TreeSnapshot snapshot, String rootName) {
        Map<String, Boolean> entries = new TreeMap<>(BY_SEGMENTS);
        snapshot.getFolders().keySet().forEach(path -> entries.put(path, true));
        snapshot.getFiles().keySet().forEach(path -> entries.put(path, false));

        StringBuilder result = new StringBuilder(rootName).append(Util.PATH_SEPARATOR).append('\n');
        entries.forEach((path, isFolder) -> {
            for (int i = 0; i <= Util.depth(path); i++) {
                result.append(INDENT);
            }
            result.append(Util.lastSegment(path));
            if (isFolder) {
                result.append(Util.PATH_SEPARATOR);
            }
            if (snapshot.getIncompletePaths().contains(path)) {
                result.append(" (incomplete)");
            }
            result.append('\n');
        });
        return result.toString();
    }
}
