package com.gamefamily.service;

import com.gamefamily.events.FamilyEventSink;
import com.gamefamily.model.BatchResetResult;
import com.gamefamily.model.FamilyErrorCode;
import com.gamefamily.model.FamilyLink;
import com.gamefamily.model.FamilyMember;
import com.gamefamily.model.FamilyOperationException;
import com.gamefamily.model.LinkChange;
import com.gamefamily.model.LinkResult;
import com.gamefamily.model.RepAward;
import com.gamefamily.model.SubtreeDissolution;
import com.gamefamily.model.SubtreeDissolutionException;
import com.gamefamily.repository.FamilyMemberRepository;
import com.gamefamily.tenant.TenantContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;

/**
 * Runs against family-members.sql:
 *
 * <pre>
 *   1001 (50) ─┬─ 1002 (45)        1004 (40) ── 1005 (60)
 *              └─ 1003 (60)
 *   1006 (50, daily 4500)   1007 (48)   1008 (50, other map)   1009 (100)
 * </pre>
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Sql("/family-members.sql")
class RelationshipProcessorTest {

    private static final UUID TENANT = UUID.fromString("11111111-1111-1111-1111-111111111111");

    private static final long SENIOR = 1001L;
    private static final long JUNIOR_A = 1002L;
    private static final long JUNIOR_B = 1003L;
    private static final long LOW_SENIOR = 1004L;
    private static final long HIGH_JUNIOR = 1005L;
    private static final long NEAR_CAP = 1006L;
    private static final long LONER = 1007L;
    private static final long FAR_AWAY = 1008L;
    private static final long VETERAN = 1009L;
    private static final long UNKNOWN = 9999L;

    @Autowired
    private RelationshipProcessor processor;

    @SpyBean
    private FamilyMemberRepository repository;

    @MockBean
    private FamilyEventSink events;

    @BeforeEach
    void bindTenant() {
        TenantContext.set(TENANT);
    }

    @AfterEach
    void clearTenant() {
        TenantContext.clear();
    }

    @Nested
    @DisplayName("link")
    class Link {

        @Test
        void linksBothSides() {
            LinkResult result = processor.link(LONER, NEAR_CAP);

            assertThat(result.senior().juniorIds()).containsExactly(NEAR_CAP);
            assertThat(result.junior().seniorId()).isEqualTo(LONER);
            assertThat(processor.getMember(LONER).juniorIds()).containsExactly(NEAR_CAP);
            assertThat(processor.getMember(NEAR_CAP).seniorId()).isEqualTo(LONER);
        }

        @Test
        void rejectsSelfReference() {
            assertCode(FamilyErrorCode.SELF_REFERENCE, () -> processor.link(LONER, LONER));
        }

        @Test
        void rejectsMissingSeniorOrJunior() {
            assertCode(FamilyErrorCode.SENIOR_NOT_FOUND, () -> processor.link(UNKNOWN, LONER));
            assertCode(FamilyErrorCode.JUNIOR_NOT_FOUND, () -> processor.link(LONER, UNKNOWN));
        }

        @Test
        void rejectsThirdJuniorWithoutChangingAnyone() {
            assertCode(FamilyErrorCode.SENIOR_FULL, () -> processor.link(SENIOR, LONER));

            assertThat(processor.getMember(SENIOR).juniorIds()).containsExactly(JUNIOR_A, JUNIOR_B);
            assertThat(processor.getMember(LONER).hasSenior()).isFalse();
        }

        @Test
        void rejectsJuniorThatAlreadyHasSenior() {
            assertCode(FamilyErrorCode.JUNIOR_ALREADY_LINKED, () -> processor.link(LONER, JUNIOR_A));
        }

        @Test
        void rejectsRepeatedLink() {
            processor.link(LONER, NEAR_CAP);

            assertCode(FamilyErrorCode.JUNIOR_ALREADY_LINKED, () -> processor.link(LONER, NEAR_CAP));
            assertThat(processor.getMember(LONER).juniorIds()).containsExactly(NEAR_CAP);
        }

        @Test
        void rejectsLevelGap() {
            assertCode(FamilyErrorCode.LEVEL_GAP_TOO_LARGE, () -> processor.link(LONER, VETERAN));
        }

        @Test
        void rejectsDifferentMap() {
            assertCode(FamilyErrorCode.LOCATION_MISMATCH, () -> processor.link(LONER, FAR_AWAY));
        }
    }

    @Nested
    @DisplayName("unlink")
    class Unlink {

        @Test
        void linkThenUnlinkRestoresBothSides() {
            processor.link(LONER, NEAR_CAP);

            LinkChange change = processor.unlink(NEAR_CAP);

            assertThat(change.brokenLinks()).containsExactly(new FamilyLink(LONER, NEAR_CAP));
            assertThat(processor.getMember(LONER).hasJuniors()).isFalse();
            assertThat(processor.getMember(NEAR_CAP).hasSenior()).isFalse();
        }

        @Test
        void juniorLeavingKeepsSibling() {
            processor.unlink(JUNIOR_A);

            assertThat(processor.getMember(SENIOR).juniorIds()).containsExactly(JUNIOR_B);
            assertThat(processor.getMember(JUNIOR_B).seniorId()).isEqualTo(SENIOR);
        }

        @Test
        void seniorLeavingReleasesAllJuniors() {
            LinkChange change = processor.unlink(SENIOR);

            assertThat(change.brokenLinks()).containsExactlyInAnyOrder(
                new FamilyLink(SENIOR, JUNIOR_A), new FamilyLink(SENIOR, JUNIOR_B));
            assertThat(change.updatedMembers()).extracting(FamilyMember::characterId)
                .containsExactly(JUNIOR_A, JUNIOR_B, SENIOR);
            assertThat(processor.getMember(JUNIOR_A).hasSenior()).isFalse();
            assertThat(processor.getMember(JUNIOR_B).hasSenior()).isFalse();
            assertThat(processor.getMember(SENIOR).hasJuniors()).isFalse();
        }

        @Test
        void middleMemberLosesSeniorAndJuniors() {
            processor.unlink(JUNIOR_B);
            processor.link(SENIOR, LOW_SENIOR);

            LinkChange change = processor.unlink(LOW_SENIOR);

            assertThat(change.brokenLinks()).containsExactly(
                new FamilyLink(SENIOR, LOW_SENIOR), new FamilyLink(LOW_SENIOR, HIGH_JUNIOR));
            assertThat(change.updatedMembers()).extracting(FamilyMember::characterId)
                .containsExactly(SENIOR, HIGH_JUNIOR, LOW_SENIOR);
            assertThat(processor.getMember(SENIOR).juniorIds()).containsExactly(JUNIOR_A);
            assertThat(processor.getMember(HIGH_JUNIOR).hasSenior()).isFalse();
            FamilyMember middle = processor.getMember(LOW_SENIOR);
            assertThat(middle.hasSenior()).isFalse();
            assertThat(middle.hasJuniors()).isFalse();
        }

        @Test
        void linksChangedBeforeLockingAreReadAgain() {
            FamilyMember stale = processor.getMember(LOW_SENIOR).toBuilder().clearJuniors().build();
            doReturn(Optional.of(stale)).doCallRealMethod().when(repository).findByCharacterId(LOW_SENIOR);

            LinkChange change = processor.unlink(LOW_SENIOR);

            assertThat(change.brokenLinks()).containsExactly(new FamilyLink(LOW_SENIOR, HIGH_JUNIOR));
            assertThat(processor.getMember(HIGH_JUNIOR).hasSenior()).isFalse();
        }

        @Test
        void givesUpWhenLinksKeepChanging() {
            FamilyMember stale = processor.getMember(LOW_SENIOR).toBuilder().clearJuniors().build();
            doReturn(Optional.of(stale)).when(repository).findByCharacterId(LOW_SENIOR);

            assertCode(FamilyErrorCode.TRANSACTION_FAILED, () -> processor.unlink(LOW_SENIOR));
        }

        @Test
        void rejectsMemberWithoutLinks() {
            assertCode(FamilyErrorCode.NO_LINK_TO_BREAK, () -> processor.unlink(LONER));
            assertCode(FamilyErrorCode.MEMBER_NOT_FOUND, () -> processor.unlink(UNKNOWN));
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        void removesJuniorAndDetachesFromSenior() {
            LinkChange change = processor.remove(JUNIOR_A);

            assertThat(change.brokenLinks()).containsExactly(new FamilyLink(SENIOR, JUNIOR_A));
            assertThat(repository.existsByCharacterId(JUNIOR_A)).isFalse();
            assertThat(processor.getMember(SENIOR).juniorIds()).containsExactly(JUNIOR_B);
        }

        @Test
        void removesUnlinkedMember() {
            LinkChange change = processor.remove(LONER);

            assertThat(change.brokenLinks()).isEmpty();
            assertThat(repository.existsByCharacterId(LONER)).isFalse();
        }

        @Test
        void rejectsUnknownMember() {
            assertCode(FamilyErrorCode.MEMBER_NOT_FOUND, () -> processor.remove(UNKNOWN));
        }
    }

    @Nested
    @DisplayName("dissolveSubtree")
    class DissolveSubtree {

        @Test
        void removesJuniorsThenSenior() {
            SubtreeDissolution dissolution = processor.dissolveSubtree(SENIOR);

            assertThat(dissolution.removedIds()).containsExactly(JUNIOR_A, JUNIOR_B, SENIOR);
            assertThat(repository.existsByCharacterId(SENIOR)).isFalse();
            assertThat(repository.existsByCharacterId(JUNIOR_A)).isFalse();
            assertThat(repository.existsByCharacterId(JUNIOR_B)).isFalse();
        }

        @Test
        void reportsCompletedWorkWhenRemovalFails() {
            doThrow(new DataAccessResourceFailureException("disk full")).when(repository).deleteByCharacterId(JUNIOR_B);

            try {
                processor.dissolveSubtree(SENIOR);
                fail("expected SubtreeDissolutionException");
            } catch (SubtreeDissolutionException e) {
                assertThat(e.code()).isEqualTo(FamilyErrorCode.DISSOLUTION_INCOMPLETE);
                assertThat(e.removedIds()).containsExactly(JUNIOR_A);
                assertThat(e.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
            }
        }

        @Test
        void unknownSeniorIsNotFound() {
            assertCode(FamilyErrorCode.MEMBER_NOT_FOUND, () -> processor.dissolveSubtree(UNKNOWN));
        }
    }

    @Nested
    @DisplayName("reputation")
    class Reputation {

        @Test
        void awardFillsCapExactly() {
            FamilyMember member = processor.awardRep(NEAR_CAP, 500);

            assertThat(member.rep()).isEqualTo(5000);
            assertThat(member.dailyRep()).isEqualTo(5000);
        }

        @Test
        void awardOverCapIsRejectedWithoutPartialIncrement() {
            assertCode(FamilyErrorCode.REP_CAP_EXCEEDED, () -> processor.awardRep(NEAR_CAP, 600));

            FamilyMember member = processor.getMember(NEAR_CAP);
            assertThat(member.dailyRep()).isEqualTo(4500);
            assertThat(member.rep()).isEqualTo(4500);
        }

        @Test
        void secondAwardOverCapLeavesFirstInPlace() {
            processor.awardRep(LONER, 4500);

            assertCode(FamilyErrorCode.REP_CAP_EXCEEDED, () -> processor.awardRep(LONER, 600));
            assertThat(processor.getMember(LONER).dailyRep()).isEqualTo(4500);
        }

        @Test
        void hugeAwardIsOverTheCap() {
            assertCode(FamilyErrorCode.REP_CAP_EXCEEDED, () -> processor.awardRep(NEAR_CAP, Long.MAX_VALUE));

            assertThat(processor.getMember(NEAR_CAP).rep()).isEqualTo(4500);
        }

        @Test
        void awardRejectsNonPositiveAmount() {
            assertCode(FamilyErrorCode.INVALID_AMOUNT, () -> processor.awardRep(LONER, 0));
            assertCode(FamilyErrorCode.MEMBER_NOT_FOUND, () -> processor.awardRep(UNKNOWN, 10));
        }

        @Test
        void deductLeavesDailyCounterAlone() {
            FamilyMember member = processor.deductRep(SENIOR, 200);

            assertThat(member.rep()).isEqualTo(1000);
            assertThat(member.dailyRep()).isEqualTo(100);
        }

        @Test
        void deductRejectsOverdraw() {
            assertCode(FamilyErrorCode.INSUFFICIENT_REP, () -> processor.deductRep(LONER, 1));
            assertCode(FamilyErrorCode.INVALID_AMOUNT, () -> processor.deductRep(SENIOR, -5));
        }

        @Test
        void resetClearsEveryCounterOnce() {
            BatchResetResult first = processor.resetDailyRep();
            BatchResetResult second = processor.resetDailyRep();

            assertThat(first.affectedCount()).isEqualTo(3);
            assertThat(second.affectedCount()).isZero();
            assertThat(processor.getMember(NEAR_CAP).dailyRep()).isZero();
            assertThat(processor.getMember(NEAR_CAP).rep()).isEqualTo(4500);
        }
    }

    @Nested
    @DisplayName("awardRepToSenior")
    class AwardRepToSenior {

        @Test
        void halvesWhenJuniorOutlevelsSenior() {
            RepAward award = processor.awardRepToSenior(HIGH_JUNIOR, 100, "quest");

            assertThat(award.amount()).isEqualTo(50);
            assertThat(award.member().characterId()).isEqualTo(LOW_SENIOR);
            assertThat(processor.getMember(LOW_SENIOR).rep()).isEqualTo(350);
        }

        @Test
        void fullAmountWhenSeniorIsHigherLevel() {
            RepAward award = processor.awardRepToSenior(JUNIOR_A, 100, "quest");

            assertThat(award.amount()).isEqualTo(100);
            assertThat(processor.getMember(SENIOR).dailyRep()).isEqualTo(200);
        }

        @Test
        void halvedToZeroChangesNothing() {
            RepAward award = processor.awardRepToSenior(HIGH_JUNIOR, 1, "quest");

            assertThat(award.amount()).isZero();
            assertThat(processor.getMember(LOW_SENIOR).rep()).isEqualTo(300);
        }

        @Test
        void juniorUnlinkedAfterLookupDoesNotPaySenior() {
            FamilyMember linked = processor.getMember(JUNIOR_A);
            processor.unlink(JUNIOR_A);
            doReturn(Optional.of(linked)).when(repository).findByCharacterId(JUNIOR_A);

            assertCode(FamilyErrorCode.NO_SENIOR, () -> processor.awardRepToSenior(JUNIOR_A, 100, "quest"));
            assertThat(processor.getMember(SENIOR).rep()).isEqualTo(1200);
        }

        @Test
        void rejectsJuniorWithoutSenior() {
            assertCode(FamilyErrorCode.NO_SENIOR, () -> processor.awardRepToSenior(LONER, 10, "quest"));
            assertCode(FamilyErrorCode.MEMBER_NOT_FOUND, () -> processor.awardRepToSenior(UNKNOWN, 10, "quest"));
        }
    }

    @Nested
    @DisplayName("processActivity")
    class ProcessActivity {

        @Test
        void twelveKillsEarnFour() {
            Optional<RepAward> award = processor.processActivity(JUNIOR_A, "mob_kill", 12);

            assertThat(award).isPresent();
            assertThat(award.get().amount()).isEqualTo(4);
            assertThat(award.get().source()).isEqualTo("mob_kills");
            assertThat(processor.getMember(SENIOR).rep()).isEqualTo(1204);
        }

        @Test
        void fourKillsEarnNothing() {
            assertThat(processor.processActivity(JUNIOR_A, "mob_kill", 4)).isEmpty();
            assertThat(processor.getMember(SENIOR).rep()).isEqualTo(1200);
        }

        @Test
        void expeditionIsHalvedForHigherJunior() {
            Optional<RepAward> award = processor.processActivity(HIGH_JUNIOR, "expedition", 10);

            assertThat(award).get().extracting(RepAward::amount).isEqualTo(50L);
        }

        @Test
        void overflowingExpeditionTallyAwardsNothing() {
            assertCode(FamilyErrorCode.INVALID_AMOUNT,
                () -> processor.processActivity(JUNIOR_A, "expedition", 1844674407370955162L));

            assertThat(processor.getMember(SENIOR).rep()).isEqualTo(1200);
        }

        @Test
        void rejectsUnknownTypeAndNegativeValue() {
            assertCode(FamilyErrorCode.INVALID_ACTIVITY_TYPE, () -> processor.processActivity(JUNIOR_A, "fishing", 5));
            assertCode(FamilyErrorCode.INVALID_AMOUNT, () -> processor.processActivity(JUNIOR_A, "mob_kill", -5));
        }
    }

    @Nested
    @DisplayName("getFamilyTree")
    class GetFamilyTree {

        @Test
        void juniorSeesSeniorAndSibling() {
            List<FamilyMember> tree = processor.getFamilyTree(JUNIOR_A);

            assertThat(tree).extracting(FamilyMember::characterId).containsExactly(JUNIOR_A, SENIOR, JUNIOR_B);
        }

        @Test
        void seniorSeesJuniors() {
            List<FamilyMember> tree = processor.getFamilyTree(SENIOR);

            assertThat(tree).extracting(FamilyMember::characterId).containsExactly(SENIOR, JUNIOR_A, JUNIOR_B);
        }

        @Test
        void unknownMemberIsNotFound() {
            assertCode(FamilyErrorCode.MEMBER_NOT_FOUND, () -> processor.getFamilyTree(UNKNOWN));
        }
    }

    private static void assertCode(FamilyErrorCode expected, Executable action) {
        try {
            action.execute();
        } catch (FamilyOperationException e) {
            assertThat(e.code()).isEqualTo(expected);
            return;
        } catch (Throwable t) {
            fail("expected " + expected + " but got " + t);
        }
        fail("expected " + expected + " but nothing was thrown");
    }
}
