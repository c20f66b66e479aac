package com.dcruver.goldenset;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.config.CurationProperties.Kit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A two-archetype kit table: blog is server-backed, notes MVP is static.
 */
public final class TestKits {

    private TestKits() {
    }

    public static CurationProperties properties() {
        CurationProperties properties = new CurationProperties();
        properties.setArchetypes(new ArrayList<>(List.of("blog", "notes")));
        properties.setComplexities(new ArrayList<>(List.of("MVP", "Pro")));
        properties.setLocales(new ArrayList<>(List.of("en")));

        Map<String, Map<String, Kit>> kits = new LinkedHashMap<>();
        kits.put("blog", Map.of(
            "MVP", kit(true,
                List.of("Home", "Post Detail", "About"),
                List.of("Publish posts with a title and body", "Readers leave comments on posts",
                    "Chronological post listing on the home page"),
                List.of("**User**: id, username, email, password_hash, created_at",
                    "**Post**: id, title, content, author_id, created_at, updated_at")),
            "Pro", kit(true,
                List.of("Home", "Post Detail", "Author Profiles", "Categories", "Search", "Admin Dashboard"),
                List.of("Rich text editor with draft and publish states", "Categories and tags for organizing posts",
                    "Full text search across posts", "Comment moderation queue for admins"),
                List.of("**User**: id, username, email, password_hash, created_at",
                    "**Post**: id, title, content, author_id, created_at, updated_at",
                    "**Category**: id, name, description",
                    "**Tag**: id, name"))));
        kits.put("notes", Map.of(
            "MVP", kit(false,
                List.of("Home", "Notes List", "Note Editor"),
                List.of("Create, edit and delete notes in the browser", "Notes persist in local storage",
                    "Quick filter by title"),
                List.of("**Note**: id, title, content, created_at, updated_at")),
            "Pro", kit(true,
                List.of("Home", "Notes List", "Note Editor", "Categories", "Sync Status"),
                List.of("Accounts with notes synced across devices", "Categories for grouping notes",
                    "Markdown preview while editing"),
                List.of("**User**: id, username, email, password_hash, created_at",
                    "**Note**: id, user_id, title, content, created_at, updated_at"))));
        properties.setKits(kits);
        return properties;
    }

    private static Kit kit(boolean server, List<String> pages, List<String> features, List<String> models) {
        Kit kit = new Kit();
        kit.setServer(server);
        kit.setPages(new ArrayList<>(pages));
        kit.setFeatures(new ArrayList<>(features));
        kit.setModels(new ArrayList<>(models));
        return kit;
    }
}
