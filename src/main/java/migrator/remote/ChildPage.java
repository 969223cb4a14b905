package migrator.remote;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of a folder listing.
 */
public final class ChildPage {
    private final List<RemoteNode> items;
    private final String nextPageToken;

    public ChildPage(List<RemoteNode> items, String nextPageToken) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.nextPageToken = nextPageToken;
    }

    public List<RemoteNode> getItems() {
        return items;
    }

    /**
     * @return Opaque token to request the next page with, or {@code null} if this is the last page.
     */
    public String getNextPageToken() {
        return nextPageToken;
    }
}
