package com.dcruver.goldenset.synthesis;

import java.util.List;
import java.util.Map;

/**
 * Phrase banks the template synthesizer draws from.
 * Nothing here may mention network binding terms; static specs reuse the same banks.
 */
final class WordingBanks {

    private WordingBanks() {
    }

    static final List<String> VISION_STATEMENTS = List.of(
        "Build a focused, friendly web application",
        "Deliver a simple and reliable web experience",
        "Create a polished single-purpose web app",
        "Ship a lightweight, approachable application",
        "Provide a clean and dependable web tool",
        "Offer an intuitive application built around one clear job"
    );

    static final Map<String, String> ARCHETYPE_PURPOSE = Map.of(
        "blog", "create, publish, and manage blog content with ease.",
        "guestbook", "leave messages, comments, and interact with site visitors.",
        "chat", "communicate in real time with other users in a structured environment.",
        "notes", "create, organize, and retrieve personal notes efficiently.",
        "dashboard", "visualize and analyze key metrics and data points.",
        "store", "browse products, manage a shopping cart, and complete purchases.",
        "gallery", "showcase and organize visual content in an appealing way."
    );

    static final Map<String, String> COMPLEXITY_FOCUS = Map.of(
        "MVP", "The initial version will focus on core functionality while maintaining a clean, intuitive interface.",
        "Pro", "This professional version includes advanced features, robust security, and an enhanced user experience."
    );

    static final List<String> TECH_STACK_INTROS = List.of(
        "The application relies on a small, well-understood set of tools.",
        "The stack favors mature technologies with good documentation.",
        "Technology choices keep the project easy to run and easy to change.",
        "The following tools were chosen for simplicity and long-term maintainability."
    );

    static final List<String> FRONTEND_OPTIONS = List.of(
        "React with Vite", "Vue 3 with Vite", "Svelte", "plain HTML, CSS and vanilla JavaScript", "Preact"
    );

    static final List<String> BACKEND_OPTIONS = List.of(
        "Node.js with Express", "Python with Flask", "Python with FastAPI", "Node.js with Fastify"
    );

    static final List<String> DATABASE_OPTIONS = List.of(
        "SQLite", "PostgreSQL", "Replit Database"
    );

    static final List<String> DEPLOYMENT_OPTIONS = List.of(
        "Replit Deployments", "Replit autoscale deployment", "Replit reserved deployment"
    );

    static final List<String> DATA_MODEL_INTROS = List.of(
        "The core entities and their fields are listed below.",
        "Data is organized around a handful of simple records.",
        "The following models capture everything the application stores.",
        "Each record type below maps directly to a screen or workflow."
    );

    static final List<String> ROUTES_INTROS = List.of(
        "The application exposes the following pages.",
        "Navigation is organized around these routes.",
        "Each page below has a single clear responsibility.",
        "The route map is intentionally small and predictable."
    );

    static final List<String> FEATURE_PLAN_INTROS = List.of(
        "Features are delivered in the order below.",
        "The feature plan lists capabilities by priority.",
        "Work is broken into small, shippable features.",
        "The following features make up the first complete release."
    );

    static final List<String> NFR_INTROS = List.of(
        "The application should meet these quality targets.",
        "Non-functional requirements are grouped by concern.",
        "These targets define what a healthy release looks like.",
        "Quality goals are kept measurable wherever possible."
    );

    static final Map<String, List<String>> NFR_CATEGORIES = Map.of(
        "Performance", List.of(
            "Pages render meaningful content within two seconds on a typical connection.",
            "Interactive actions respond within 200 ms for the median user.",
            "Static assets are compressed and cached aggressively.",
            "List views paginate so no page loads more than fifty records."
        ),
        "Security", List.of(
            "All form input is validated and escaped before rendering.",
            "Secrets are stored in Replit Secrets and never committed.",
            "Sessions expire after a period of inactivity.",
            "Role checks run on every state-changing action."
        ),
        "Reliability", List.of(
            "Failed saves are reported to the user and can be retried safely.",
            "Data is backed up daily with a tested restore procedure.",
            "Errors are logged with enough context to reproduce them.",
            "The application degrades gracefully when optional features fail."
        ),
        "Usability", List.of(
            "Layouts adapt to phone, tablet and desktop widths.",
            "Every interactive element is reachable from the keyboard.",
            "Color contrast meets accessibility guidelines.",
            "Empty states explain what to do next."
        ),
        "Maintainability", List.of(
            "Code is formatted automatically and linted on every change.",
            "Each feature lives in its own module with clear boundaries.",
            "Configuration is kept in one place and documented.",
            "Dependencies are pinned and reviewed monthly."
        )
    );

    static final List<String> NFR_ORDER = List.of(
        "Performance", "Security", "Reliability", "Usability", "Maintainability"
    );

    static final List<String> PADDING_SENTENCES = List.of(
        "The team will review this plan after the first week of usage and adjust priorities.",
        "Early feedback from real users will shape the order of later features.",
        "Every screen should make the primary action obvious without extra explanation.",
        "Copy throughout the interface stays short, friendly and consistent in tone.",
        "Edge cases such as empty lists and very long titles are handled explicitly.",
        "Visual design follows a small palette and a single typeface for clarity.",
        "Analytics are limited to aggregate page views and contain no personal data.",
        "Each release is tagged so that any version can be rebuilt exactly.",
        "Documentation covers setup, daily use and common troubleshooting steps.",
        "Automated tests cover the main user journeys before each deployment.",
        "Forms keep entered values when validation fails so nothing is lost.",
        "Dates and times are displayed in the viewer's local format.",
        "Loading indicators appear only when an action takes noticeable time.",
        "Destructive actions always ask for confirmation and can be undone where possible.",
        "Search results highlight the matching terms to speed up scanning.",
        "The layout keeps navigation in the same place on every page.",
        "Images are resized on upload to keep pages fast on slow connections.",
        "Accessibility checks run alongside the regular automated test suite.",
        "Administrators can export the stored data in a portable format at any time.",
        "Configuration defaults are chosen so the app works well without tuning.",
        "Feature flags allow unfinished work to ship without being visible.",
        "Error messages describe what went wrong and how to fix it.",
        "Onboarding hints disappear once the user has completed each step.",
        "Keyboard shortcuts are documented on a dedicated help panel.",
        "The data model leaves room for localization without schema changes.",
        "Performance budgets are checked automatically during continuous integration.",
        "Content is sanitized on save as well as on display for defense in depth.",
        "A changelog summarizes user-visible changes for every release.",
        "Stale sessions are cleaned up by a scheduled maintenance task.",
        "Metrics dashboards track adoption of each major feature over time.",
        "Support requests are triaged weekly and linked to the relevant feature.",
        "The visual style adapts to the operating system dark mode preference.",
        "Bulk actions let administrators handle many records in a single step.",
        "Every list can be sorted by its most useful columns.",
        "Pagination controls show the total count so users know where they are.",
        "Uploads show progress and can be cancelled before they finish.",
        "Notifications are batched to avoid interrupting users too often.",
        "The project roadmap is revisited at the end of every milestone.",
        "Usage limits are generous for normal use and protect against abuse.",
        "Sample data is available so new contributors can explore quickly."
    );

    // Padding sentences are also composed as lead + subject + claim
    static final List<String> PADDING_LEADS = List.of(
        "In practice,", "Over time,", "For the first release,", "Where possible,", "During review,",
        "As usage grows,", "By default,", "On every screen,", "After launch,", "Before each release,",
        "For new visitors,", "Within the team,", "When in doubt,", "Across devices,", "For returning users,"
    );

    static final List<String> PADDING_SUBJECTS = List.of(
        "the onboarding flow", "each list view", "the navigation menu", "every error message", "empty states",
        "the settings page", "form validation", "keyboard shortcuts", "loading indicators", "the color palette",
        "search results", "confirmation dialogs", "page titles", "inline help text", "image thumbnails",
        "date formatting", "the footer links", "toast notifications"
    );

    static final List<String> PADDING_CLAIMS = List.of(
        "should stay short and consistent in tone.",
        "must remain usable on small screens.",
        "is reviewed against real user feedback.",
        "favors clarity over decoration.",
        "keeps the primary action obvious.",
        "is covered by automated checks.",
        "avoids jargon and unexplained abbreviations.",
        "follows the same spacing rules everywhere.",
        "loads quickly even on slow connections.",
        "is documented for future maintainers.",
        "respects reduced motion preferences.",
        "remains readable with large text settings.",
        "gets a second look before each release.",
        "degrades gracefully when data is missing.",
        "uses plain language that new visitors understand.",
        "stays predictable across repeated visits."
    );

    static final Map<String, String> PAGE_DESCRIPTIONS = Map.ofEntries(
        Map.entry("Post Detail", "Displays a single blog post with comments"),
        Map.entry("About", "Information about the site and its authors"),
        Map.entry("Author Profiles", "Details about each author"),
        Map.entry("Categories", "Browse entries by category"),
        Map.entry("Search", "Search for content by keyword"),
        Map.entry("Admin Dashboard", "Manage content and settings"),
        Map.entry("Entry Form", "Form for submitting new guestbook entries"),
        Map.entry("User Profiles", "View user profile information"),
        Map.entry("Admin Panel", "Moderate entries and manage users"),
        Map.entry("Chat Room", "Main chat interface"),
        Map.entry("Login", "User authentication page"),
        Map.entry("Chat Rooms", "List of available chat rooms"),
        Map.entry("Direct Messages", "Private conversations between users"),
        Map.entry("Settings", "User preferences and account settings"),
        Map.entry("Notes List", "Overview of all notes"),
        Map.entry("Note Editor", "Create and edit notes"),
        Map.entry("Sync Status", "View synchronization status"),
        Map.entry("Overview", "Main dashboard view"),
        Map.entry("Data View", "Detailed data visualization"),
        Map.entry("Detailed Analytics", "In-depth data analysis"),
        Map.entry("Reports", "Generated reports and exports"),
        Map.entry("User Management", "Manage user accounts and permissions"),
        Map.entry("System Settings", "Configure system parameters"),
        Map.entry("Product List", "Browse available products"),
        Map.entry("Product Detail", "View detailed product information"),
        Map.entry("Cart", "Review items before checkout"),
        Map.entry("Checkout", "Complete the purchase"),
        Map.entry("Product Categories", "Browse products by category"),
        Map.entry("User Account", "Manage account details"),
        Map.entry("Order History", "View past orders"),
        Map.entry("Gallery Grid", "Grid layout of images"),
        Map.entry("Image View", "Detailed view of a single image"),
        Map.entry("Image Detail", "Expanded image with metadata"),
        Map.entry("Collections", "Grouped sets of images"),
        Map.entry("Upload", "Add new images to the gallery")
    );

    static final String ACL_SNIPPET = String.join("\n",
        "### Access Control",
        "",
        "- **Member**: `read:self`, `write:self`",
        "- **Admin**: `read:any`, `write:any`, `manage`");
}
