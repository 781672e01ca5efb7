package com.modelpack.types;

import com.modelpack.util.Hashing;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class IndexTest {

    private static Descriptor manifest(String content) {
        return new Descriptor(MediaTypes.OCI_MANIFEST,
                Hashing.sha256(content.getBytes(StandardCharsets.UTF_8)), content.length());
    }

    @Test
    void shouldRebindTag() {
        Descriptor first = manifest("first");
        Descriptor second = manifest("second");

        Index index = Index.empty().withTag(first, "v1").withTag(second, "v1");

        assertThat(index.manifests()).hasSize(1);
        assertThat(index.findByTag("v1")).get().extracting(Descriptor::digest).isEqualTo(second.digest());
    }

    @Test
    void shouldReplaceUntaggedEntryWhenTagged() {
        Descriptor m = manifest("m");

        Index index = Index.empty().withManifest(m).withTag(m, "latest");

        assertThat(index.manifests()).hasSize(1);
        assertThat(index.tags()).containsExactly("latest");
    }

    @Test
    void shouldKeepOtherTagsOfSameDigestOnUntag() {
        Descriptor m = manifest("m");

        Index index = Index.empty().withTag(m, "a").withTag(m, "b").withoutTag("a");

        assertThat(index.tags()).containsExactly("b");
        assertThat(index.findByDigest(m.digest())).hasSize(1);
    }

    @Test
    void shouldDropAllEntriesForDigest() {
        Descriptor m = manifest("m");
        Descriptor other = manifest("other");

        Index index = Index.empty().withTag(m, "a").withTag(m, "b").withTag(other, "c")
                .withoutDigest(m.digest());

        assertThat(index.tags()).containsExactly("c");
    }

    @Test
    void shouldIgnoreDuplicateUntaggedPush() {
        Descriptor m = manifest("m");

        Index index = Index.empty().withTag(m, "a").withManifest(m);

        assertThat(index.manifests()).hasSize(1);
    }
}
