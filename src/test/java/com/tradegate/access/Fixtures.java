package com.tradegate.access;

import com.tradegate.access.domain.DomainModels.CompletionRequirement;
import com.tradegate.access.domain.DomainModels.ContentLevel;
import com.tradegate.access.domain.DomainModels.ContentType;
import com.tradegate.access.domain.DomainModels.EducationalContent;
import com.tradegate.access.domain.DomainModels.LearningPath;
import com.tradegate.access.domain.DomainModels.LearningPathItem;
import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.DomainModels.User;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/** Builders for catalog and user rows; every id is unique so tests share one context safely. */
public final class Fixtures {
    private Fixtures() {
    }

    public static String id(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static EducationalContent module(String id) {
        return new EducationalContent(id, id, "Module " + id, ContentType.MODULE, ContentLevel.BEGINNER,
                CompletionRequirement.NONE, null, 10, null, null);
    }

    public static EducationalContent quiz(String id, Double passingScore) {
        return new EducationalContent(id, id, "Quiz " + id, ContentType.QUIZ, ContentLevel.BEGINNER,
                CompletionRequirement.QUIZ, passingScore, 5, null, null);
    }

    /** Items in the given order; all required unless listed in {@code optional}. */
    public static LearningPath path(String id, List<String> contentIds, String... optional) {
        List<LearningPathItem> items = new ArrayList<>();
        for (int i = 0; i < contentIds.size(); i++) {
            String contentId = contentIds.get(i);
            items.add(new LearningPathItem(id, contentId, i + 1, !List.of(optional).contains(contentId)));
        }
        return new LearningPath(id, id, "Path " + id, null, items);
    }

    public static TradingPermission permission(String id, Integer minAge, boolean guardian,
                                               String pathId, String contentId, Double minScore) {
        return new TradingPermission(id, id, "Permission " + id, "", minAge, guardian, pathId, contentId, minScore);
    }

    public static User adult(String id, SubscriptionTier tier, Role... roles) {
        Set<Role> set = roles.length == 0 ? EnumSet.of(Role.USER) : EnumSet.copyOf(List.of(roles));
        return new User(id, "Adult " + id, LocalDate.now().minusYears(30), set, tier, null);
    }

    public static User minor(String id, String guardianId, int age) {
        return new User(id, "Minor " + id, LocalDate.now().minusYears(age).minusDays(1),
                EnumSet.of(Role.USER, Role.MINOR), SubscriptionTier.FREE, guardianId);
    }

    public static User unknownAge(String id) {
        return new User(id, "Unknown " + id, null, EnumSet.of(Role.USER), SubscriptionTier.FREE, null);
    }
}
