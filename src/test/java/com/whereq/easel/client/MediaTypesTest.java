package com.whereq.easel.client;

import com.whereq.easel.model.MediaKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MediaTypesTest {

    @Test
    void guess_usesExtensionWithinKind() {
        assertEquals("image/jpeg", MediaTypes.guess(MediaKind.IMAGE, "photo.JPG"));
        assertEquals("video/webm", MediaTypes.guess(MediaKind.VIDEO, "clip.webm"));
        assertEquals("image/gif", MediaTypes.guess(MediaKind.VIDEO, "anim.gif"));
        assertEquals("audio/flac", MediaTypes.guess(MediaKind.AUDIO, "track.flac"));
    }

    @Test
    void guess_unknownExtension_isOctetStream() {
        assertEquals(MediaTypes.OCTET_STREAM, MediaTypes.guess(MediaKind.IMAGE, "latent.bin"));
        assertEquals(MediaTypes.OCTET_STREAM, MediaTypes.guess(MediaKind.AUDIO, "noext"));
        assertEquals(MediaTypes.OCTET_STREAM, MediaTypes.guess(MediaKind.VIDEO, null));
    }

    @Test
    void uploadContentType_defaultsToPng() {
        assertEquals("image/jpeg", MediaTypes.uploadContentType("in.jpeg"));
        assertEquals("image/webp", MediaTypes.uploadContentType("in.webp"));
        assertEquals("image/png", MediaTypes.uploadContentType("upload_ab12cd34"));
    }
}
