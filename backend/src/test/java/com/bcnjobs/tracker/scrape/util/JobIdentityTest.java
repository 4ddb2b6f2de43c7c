package com.bcnjobs.tracker.scrape.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobIdentityTest {

    @Test
    void keyIsTruncatedSha256OfCompanyAndUrl() {
        assertThat(JobIdentity.identityKey("acme", "https://acme.com/jobs/42")).isEqualTo("8d3b631f583c73f6");
    }

    @Test
    void keyIsStableAndSensitiveToBothParts() {
        String first = JobIdentity.identityKey("acme", "https://acme.com/jobs/42");

        assertThat(JobIdentity.identityKey("acme", "https://acme.com/jobs/42")).isEqualTo(first);
        assertThat(JobIdentity.identityKey("acme", "https://acme.com/jobs/43")).isNotEqualTo(first);
        assertThat(JobIdentity.identityKey("globex", "https://acme.com/jobs/42")).isNotEqualTo(first);
        assertThat(first).hasSize(JobIdentity.KEY_LENGTH).matches("[0-9a-f]+");
    }

    @Test
    void rejectsBlankParts() {
        assertThatThrownBy(() -> JobIdentity.identityKey(" ", "https://acme.com/jobs/42"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobIdentity.identityKey("acme", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
