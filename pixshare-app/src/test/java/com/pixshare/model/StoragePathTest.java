package com.pixshare.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoragePathTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void parsesOwnerAlbumAndRemainder() {
            StoragePath path = StoragePath.parse("photos/12/34/thumbs/beach.jpg").orElseThrow();

            assertThat(path.ownerId()).isEqualTo(UserId.of(12));
            assertThat(path.albumId()).isEqualTo(AlbumId.of(34));
            assertThat(path.remainder()).isEqualTo("thumbs/beach.jpg");
            assertThat(path.toString()).isEqualTo("photos/12/34/thumbs/beach.jpg");
        }

        @Test
        void rejectsNullAndEmpty() {
            assertThat(StoragePath.parse(null)).isEmpty();
            assertThat(StoragePath.parse("")).isEmpty();
        }

        @Test
        void rejectsTooFewSegments() {
            assertThat(StoragePath.parse("photos/1/1")).isEmpty();
        }

        @Test
        void rejectsIdsThatAreNotPlainDigits() {
            assertThat(StoragePath.parse("photos/+1/1/x.jpg")).isEmpty();
            assertThat(StoragePath.parse("photos/1/0x1/x.jpg")).isEmpty();
            assertThat(StoragePath.parse("photos/1234567890123456789/1/x.jpg")).isEmpty();
        }

        @Test
        void rejectsDotSegmentsAndControlCharacters() {
            assertThat(StoragePath.parse("photos/1/1/..")).isEmpty();
            assertThat(StoragePath.parse("photos/1/1/a..b.jpg")).isEmpty();
            assertThat(StoragePath.parse("photos/1/1/x\u0000.jpg")).isEmpty();
            assertThat(StoragePath.parse("photos/1/1/x%2e.jpg")).isEmpty();
        }

        @Test
        void rejectsOverlongPaths() {
            assertThat(StoragePath.parse("photos/1/1/" + "a".repeat(1100))).isEmpty();
        }
    }

    @Nested
    @DisplayName("safeFilename")
    class SafeFilename {

        @Test
        void keepsOrdinaryNames() {
            assertThat(StoragePath.safeFilename("IMG_0001.jpg")).isEqualTo("IMG_0001.jpg");
        }

        @Test
        void dropsDirectoryParts() {
            assertThat(StoragePath.safeFilename("C:\\Users\\me\\beach.png")).isEqualTo("beach.png");
            assertThat(StoragePath.safeFilename("../../etc/passwd")).isEqualTo("passwd");
        }

        @Test
        void replacesUnsafeCharacters() {
            assertThat(StoragePath.safeFilename("my photo (1).jpg")).isEqualTo("my_photo__1_.jpg");
        }

        @Test
        void stripsLeadingDots() {
            assertThat(StoragePath.safeFilename(".hidden.jpg")).isEqualTo("hidden.jpg");
        }

        @Test
        void resultAlwaysParses() {
            String name = StoragePath.safeFilename("..%00weird name...jpg");
            StoragePath path = StoragePath.of(UserId.of(1), AlbumId.of(2), name);

            assertThat(StoragePath.parse(path.toString())).contains(path);
        }

        @Test
        void rejectsNamesWithNothingUsable() {
            assertThatThrownBy(() -> StoragePath.safeFilename("..."))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void thumbnailSitsInThumbsDirectory() {
        StoragePath path = StoragePath.of(UserId.of(1), AlbumId.of(2), "x.jpg");

        assertThat(path.thumbnail().toString()).isEqualTo("photos/1/2/thumbs/x.jpg");
    }
}
