package com.wobble.core.discovery;

import com.wobble.core.model.CategorySource;
import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestTags;

import java.util.Optional;

/**
 * Decides a unit's category from its tags and its location.
 * <p>
 * Order: declared tag, then the innermost recognized category directory, then
 * {@link TestCategory#UNCATEGORIZED}. A tag wins over a conflicting directory.
 */
public final class CategoryResolver {

    private CategoryResolver() {}

    public record Resolution(TestCategory category, CategorySource source) {}

    public static Resolution resolve(TestTags tags, String relativeDirectory) {
        if (tags != null && tags.category() != null) {
            return new Resolution(tags.category(), CategorySource.TAG);
        }
        return directoryCategory(relativeDirectory)
                .map(category -> new Resolution(category, CategorySource.DIRECTORY))
                .orElse(new Resolution(TestCategory.UNCATEGORIZED, CategorySource.DEFAULT));
    }

    /**
     * Innermost directory segment of {@code relativeDirectory} that names a category.
     */
    public static Optional<TestCategory> directoryCategory(String relativeDirectory) {
        if (relativeDirectory == null || relativeDirectory.isEmpty()) return Optional.empty();
        String[] segments = relativeDirectory.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            Optional<TestCategory> category = TestCategory.fromDirectoryName(segments[i]);
            if (category.isPresent()) return category;
        }
        return Optional.empty();
    }
}
