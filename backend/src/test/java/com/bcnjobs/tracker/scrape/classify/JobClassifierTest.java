package com.bcnjobs.tracker.scrape.classify;

import com.bcnjobs.tracker.scrape.model.JobClassification;
import com.bcnjobs.tracker.scrape.model.WorkType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobClassifierTest {

    @Test
    void acceptsBarcelonaAndRemoteSpainLocations() {
        assertThat(JobClassifier.isTargetLocation("Remote - Spain", null, null)).isTrue();
        assertThat(JobClassifier.isTargetLocation("Barcelona, Spain", null, null)).isTrue();
        assertThat(JobClassifier.isTargetLocation("Hybrid – Barcelona", null, null)).isTrue();
        assertThat(JobClassifier.isTargetLocation("Spain (Remote)", null, null)).isTrue();
        assertThat(JobClassifier.isTargetLocation("BCN office", null, null)).isTrue();
    }

    @Test
    void rejectsOtherCitiesAndRemoteElsewhere() {
        assertThat(JobClassifier.isTargetLocation("Madrid", null, null)).isFalse();
        assertThat(JobClassifier.isTargetLocation("Remote - Germany", null, null)).isFalse();
        assertThat(JobClassifier.isTargetLocation(null, null, null)).isFalse();
    }

    @Test
    void locationCanComeFromTitleOrDescription() {
        assertThat(JobClassifier.isTargetLocation(null, "Data Scientist (Barcelona)", null)).isTrue();
        assertThat(JobClassifier.isTargetLocation("EMEA", "Data Analyst", "Fully remote\nwithin Spain")).isTrue();
    }

    @Test
    void roleMatchesTitleOrDescription() {
        assertThat(JobClassifier.isTargetRole("Senior Data Scientist", null)).isTrue();
        assertThat(JobClassifier.isTargetRole("Account Executive", null)).isFalse();
        assertThat(JobClassifier.isTargetRole("", "You will build machine learning models")).isTrue();
        assertThat(JobClassifier.isTargetRole(null, null)).isFalse();
    }

    @Test
    void languageGateRejectsThreeOrMoreMarkers() {
        String spanish = "Buscamos un perfil con experiencia. Requisitos: SQL.";
        String mixed = "We value experiencia and trabajo in teams.";

        assertThat(JobClassifier.countNonEnglishMarkers("Data Analyst", spanish)).isEqualTo(3);
        assertThat(JobClassifier.isEnglish("Data Analyst", spanish)).isFalse();
        assertThat(JobClassifier.countNonEnglishMarkers("Data Analyst", mixed)).isEqualTo(2);
        assertThat(JobClassifier.isEnglish("Data Analyst", mixed)).isTrue();
        assertThat(JobClassifier.isEnglish("Data Analyst", "Plain English text")).isTrue();
    }

    @Test
    void visaAndRelocationSignalsAreIndependent() {
        String both = "We offer visa sponsorship and a relocation package.";

        assertThat(JobClassifier.mentionsVisaSupport(null, both)).isTrue();
        assertThat(JobClassifier.mentionsRelocation(null, both)).isTrue();
        assertThat(JobClassifier.mentionsVisaSupport(null, "Relocation support available")).isFalse();
        assertThat(JobClassifier.mentionsRelocation(null, "Relocation support available")).isTrue();
        assertThat(JobClassifier.mentionsVisaSupport(null, "Valid EU work permit required")).isTrue();
        assertThat(JobClassifier.mentionsRelocation(null, "Valid EU work permit required")).isFalse();
    }

    @Test
    void hybridOverridesRemote() {
        assertThat(JobClassifier.workType("Remote - Spain", "Data Scientist")).isEqualTo(WorkType.REMOTE);
        assertThat(JobClassifier.workType("Barcelona (Hybrid, remote days)", null)).isEqualTo(WorkType.HYBRID);
        assertThat(JobClassifier.workType("Barcelona", "Data Scientist")).isEqualTo(WorkType.ON_SITE);
    }

    @Test
    void coreRoleExclusionsWinOverKeywords() {
        assertThat(JobClassifier.isCoreRole("Machine Learning Engineer", null)).isTrue();
        assertThat(JobClassifier.isCoreRole("Data Scientist Intern", null)).isFalse();
        assertThat(JobClassifier.isCoreRole("Software Engineer, Machine Learning Platform", null)).isFalse();
        assertThat(JobClassifier.isCoreRole("Quantitative Researcher", "Work alongside a data scientist")).isTrue();
    }

    @Test
    void classifyCombinesAllSignals() {
        JobClassification classification = JobClassifier.classify(
            "Senior Data Scientist",
            "Visa sponsorship available.",
            "Hybrid – Barcelona"
        );

        assertThat(classification.isForwarded()).isTrue();
        assertThat(classification.mentionsVisaSupport()).isTrue();
        assertThat(classification.mentionsRelocation()).isFalse();
        assertThat(classification.workType()).isEqualTo(WorkType.HYBRID);
        assertThat(classification.coreRole()).isTrue();
    }
}
