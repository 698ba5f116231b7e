package com.libragraph.repobuilder.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PackageLevelTest {

    @Test
    void shouldResolveEveryCode() {
        assertThat(PackageLevel.fromCode('-')).isEqualTo(PackageLevel.EXCLUDED);
        assertThat(PackageLevel.fromCode('S')).isEqualTo(PackageLevel.SMALL);
        assertThat(PackageLevel.fromCode('M')).isEqualTo(PackageLevel.MEDIUM);
        assertThat(PackageLevel.fromCode('L')).isEqualTo(PackageLevel.LARGE);
        assertThat(PackageLevel.fromCode('T')).isEqualTo(PackageLevel.TOTAL);
    }

    @Test
    void shouldRejectUnknownCode() {
        assertThat(PackageLevel.isCode('X')).isFalse();
        assertThatIllegalArgumentException()
                .isThrownBy(() -> PackageLevel.fromCode('X'))
                .withMessageContaining("X");
    }

    @Test
    void onlyExcludedIsExcluded() {
        assertThat(PackageLevel.EXCLUDED.isExcluded()).isTrue();
        assertThat(PackageLevel.TOTAL.isExcluded()).isFalse();
    }
}
