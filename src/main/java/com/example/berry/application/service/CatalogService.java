package com.example.berry.application.service;

import com.example.berry.common.config.AppCatalogProperties;
import com.example.berry.domain.model.CatalogItem;
import com.example.berry.domain.model.PlaybackSnapshot;
import com.example.berry.infrastructure.catalog.CatalogEntry;
import com.example.berry.infrastructure.catalog.CatalogStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Carousel items: the catalog plus, while something outside the catalog plays, one transient
 * temp item at the end. The catalog comes from the saved file once one exists, otherwise from
 * configuration; saving the temp item and deleting entries write the file.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CatalogStore catalogStore;
    private final Clock wallClock;

    private volatile List<CatalogItem> items;
    private final AtomicReference<CatalogItem> tempItem = new AtomicReference<>();

    public CatalogService(AppCatalogProperties properties, CatalogStore catalogStore, Clock wallClock) {
        this.catalogStore = catalogStore;
        this.wallClock = wallClock;
        List<CatalogEntry> stored = catalogStore.load();
        this.items = stored != null ? fromEntries(stored) : fromProperties(properties.getItems());
        log.info("Catalog loaded, itemCount={} source={}", items.size(), stored != null ? "file" : "config");
    }

    public List<CatalogItem> catalogItems() {
        return items;
    }

    public List<CatalogItem> displayItems() {
        List<CatalogItem> current = items;
        CatalogItem temp = tempItem.get();
        if (temp == null) {
            return current;
        }
        List<CatalogItem> display = new ArrayList<>(current.size() + 1);
        display.addAll(current);
        display.add(temp);
        return display;
    }

    public CatalogItem getTempItem() {
        return tempItem.get();
    }

    public boolean isInCatalog(String contextUri) {
        return findByUri(items, contextUri) != null;
    }

    public static int indexOf(List<CatalogItem> displayItems, String contextUri) {
        if (contextUri == null) {
            return -1;
        }
        for (int i = 0; i < displayItems.size(); i++) {
            if (displayItems.get(i).hasUri(contextUri)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Creates, replaces or drops the temp item to match the playing context.
     *
     * @return true when the display list changed
     */
    public boolean updateTempItem(PlaybackSnapshot snapshot) {
        String contextUri = snapshot.getContextUri();
        CatalogItem current = tempItem.get();
        if (contextUri == null || isInCatalog(contextUri)) {
            if (current != null && tempItem.compareAndSet(current, null)) {
                log.info("TempItem removed: {}", current.getName());
                return true;
            }
            return false;
        }
        if (current != null && current.hasUri(contextUri)) {
            return false;
        }
        boolean playlist = contextUri.contains("playlist");
        String fallbackName = playlist ? "Playlist" : "Album";
        CatalogItem created = CatalogItem.builder()
                .id(CatalogItem.TEMP_ID)
                .uri(contextUri)
                .name(snapshot.getTrackAlbum() == null ? fallbackName : snapshot.getTrackAlbum())
                .type(playlist ? "playlist" : "album")
                .artist(snapshot.getTrackArtist())
                .temp(true)
                .build();
        tempItem.set(created);
        log.info("TempItem: {} uri={}", created.getName(), contextUri);
        return true;
    }

    /**
     * Appends the temp item to the catalog. It takes the temp item's place at the end of the
     * carousel, so display indexes do not move.
     *
     * @return the saved item, or null when there was nothing to save or the write failed
     */
    public synchronized CatalogItem saveTempItem() {
        CatalogItem temp = tempItem.get();
        if (temp == null) {
            return null;
        }
        List<CatalogItem> current = items;
        if (findByUri(current, temp.getUri()) != null) {
            log.warn("Item already in catalog: {}", temp.getName());
            tempItem.compareAndSet(temp, null);
            return null;
        }
        CatalogItem saved = CatalogItem.builder()
                .id(nextId(current))
                .uri(temp.getUri())
                .name(temp.getName())
                .type(temp.getType())
                .artist(temp.getArtist())
                .temp(false)
                .addedAtEpochMs(wallClock.millis())
                .build();
        List<CatalogItem> updated = new ArrayList<>(current);
        updated.add(saved);
        if (!persist(updated)) {
            return null;
        }
        tempItem.compareAndSet(temp, null);
        log.info("CATALOG_EVENT event=saved id={} name={} uri={}", saved.getId(), saved.getName(), saved.getUri());
        return saved;
    }

    /**
     * Removes a catalog entry. The temp item cannot be deleted.
     *
     * @return true when the entry was removed and the catalog written
     */
    public synchronized boolean deleteItem(String id) {
        if (id == null || CatalogItem.TEMP_ID.equals(id)) {
            return false;
        }
        List<CatalogItem> current = items;
        List<CatalogItem> updated = new ArrayList<>(current.size());
        CatalogItem removed = null;
        for (CatalogItem item : current) {
            if (removed == null && id.equals(item.getId())) {
                removed = item;
            } else {
                updated.add(item);
            }
        }
        if (removed == null) {
            log.warn("Catalog item not found: {}", id);
            return false;
        }
        if (!persist(updated)) {
            return false;
        }
        log.info("CATALOG_EVENT event=deleted id={} name={}", removed.getId(), removed.getName());
        return true;
    }

    private boolean persist(List<CatalogItem> updated) {
        long now = wallClock.millis();
        List<CatalogEntry> entries = new ArrayList<>(updated.size());
        for (CatalogItem item : updated) {
            long addedAt = item.getAddedAtEpochMs() > 0 ? item.getAddedAtEpochMs() : now;
            entries.add(new CatalogEntry(item.getId(), item.getType(), item.getUri(), item.getName(),
                    item.getArtist(), addedAt));
        }
        if (!catalogStore.store(entries)) {
            log.warn("Catalog not changed, write failed");
            return false;
        }
        items = Collections.unmodifiableList(updated);
        return true;
    }

    private String nextId(List<CatalogItem> current) {
        long candidate = wallClock.millis();
        while (findById(current, String.valueOf(candidate)) != null) {
            candidate++;
        }
        return String.valueOf(candidate);
    }

    private static List<CatalogItem> fromProperties(List<AppCatalogProperties.Item> configured) {
        List<CatalogItem> loaded = new ArrayList<>();
        int index = 0;
        for (AppCatalogProperties.Item item : configured) {
            index++;
            if (item == null || isBlank(item.getUri())) {
                log.warn("Skipping catalog entry without uri, position={}", index);
                continue;
            }
            loaded.add(build(item.getId() == null ? String.valueOf(index) : item.getId(),
                    item.getUri(), item.getName(), item.getType(), item.getArtist(), 0L));
        }
        return Collections.unmodifiableList(loaded);
    }

    private static List<CatalogItem> fromEntries(List<CatalogEntry> stored) {
        List<CatalogItem> loaded = new ArrayList<>();
        int index = 0;
        for (CatalogEntry entry : stored) {
            index++;
            if (entry == null || isBlank(entry.getUri())) {
                log.warn("Skipping saved catalog entry without uri, position={}", index);
                continue;
            }
            loaded.add(build(entry.getId() == null ? String.valueOf(index) : entry.getId(),
                    entry.getUri(), entry.getName(), entry.getType(), entry.getArtist(), entry.getAddedAtEpochMs()));
        }
        return Collections.unmodifiableList(loaded);
    }

    private static CatalogItem build(String id, String uri, String name, String type, String artist,
                                     long addedAtEpochMs) {
        return CatalogItem.builder()
                .id(id)
                .uri(uri.trim())
                .name(name == null ? uri.trim() : name)
                .type(type == null ? "album" : type)
                .artist(artist)
                .temp(false)
                .addedAtEpochMs(addedAtEpochMs)
                .build();
    }

    private static CatalogItem findByUri(List<CatalogItem> list, String contextUri) {
        for (CatalogItem item : list) {
            if (item.hasUri(contextUri)) {
                return item;
            }
        }
        return null;
    }

    private static CatalogItem findById(List<CatalogItem> list, String id) {
        for (CatalogItem item : list) {
            if (id.equals(item.getId())) {
                return item;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
