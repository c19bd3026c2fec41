package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.store.Collaboration;
import io.github.mvbazaar.jobs.store.CollaboratorRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KarmaCalculatorTest {

    @Test
    void creatorAndContributorContributions() {
        List<Collaboration> collaborations = List.of(
                new Collaboration("p1", CollaboratorRole.CREATOR, 10, false),
                new Collaboration("p2", CollaboratorRole.CONTRIBUTOR, 5, false));
        assertEquals(12, KarmaCalculator.karma(collaborations));
    }

    @Test
    void eachTermIsFlooredSeparately() {
        List<Collaboration> collaborations = List.of(
                new Collaboration("p1", CollaboratorRole.ADVISOR, 3, false),
                new Collaboration("p2", CollaboratorRole.ADVISOR, 3, false),
                new Collaboration("p3", CollaboratorRole.CONTRIBUTOR, 7, false));
        // floor(0.75) + floor(0.75) + floor(3.5)
        assertEquals(3, KarmaCalculator.karma(collaborations));
    }

    @Test
    void featuredBonusOnlyForCreators() {
        List<Collaboration> collaborations = List.of(
                new Collaboration("p1", CollaboratorRole.CREATOR, 4, true),
                new Collaboration("p2", CollaboratorRole.CONTRIBUTOR, 4, true));
        assertEquals(4 + KarmaCalculator.FEATURED_BONUS + 2, KarmaCalculator.karma(collaborations));
    }

    @Test
    void unknownRoleContributesNothing() {
        assertEquals(0, KarmaCalculator.contribution(new Collaboration("p1", null, 100, true)));
        assertEquals(0, KarmaCalculator.karma(List.of(new Collaboration("p1", null, 100, true))));
    }

    @Test
    void noCollaborationsMeansZero() {
        assertEquals(0, KarmaCalculator.karma(List.of()));
    }
}
