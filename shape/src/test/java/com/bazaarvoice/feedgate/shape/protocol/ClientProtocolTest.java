package com.bazaarvoice.feedgate.shape.protocol;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

public class ClientProtocolTest {

    private static final ListMultimap<String, String> ORIGIN_HEADERS = ImmutableListMultimap.of(
            "electric-handle", "3833821-1721811548143",
            "electric-offset", "0_0",
            "electric-schema", "{}",
            "Cache-Control", "no-store");

    @Test
    public void testVersionSelectsProtocol() {
        assertEquals(ClientProtocol.forVersion(null), ClientProtocol.LEGACY);
        assertEquals(ClientProtocol.forVersion(""), ClientProtocol.LEGACY);
        assertEquals(ClientProtocol.forVersion("3.3.0"), ClientProtocol.CURRENT);
    }

    @Test
    public void testBothHandleNamesAccepted() {
        assertEquals(ClientProtocol.CURRENT.selectHandle(null, "h1"), Optional.of("h1"));
        assertEquals(ClientProtocol.LEGACY.selectHandle("h1", null), Optional.of("h1"));
        assertFalse(ClientProtocol.CURRENT.selectHandle("", null).isPresent());
    }

    @Test
    public void testOwnHandleNameWins() {
        assertEquals(ClientProtocol.CURRENT.selectHandle("current", "legacy"), Optional.of("current"));
        assertEquals(ClientProtocol.LEGACY.selectHandle("current", "legacy"), Optional.of("legacy"));
    }

    @Test
    public void testLegacyRenamesHeaders() {
        assertEquals(ClientProtocol.LEGACY.translateResponseHeaders(ORIGIN_HEADERS), ImmutableListMultimap.of(
                "electric-shape-id", "3833821-1721811548143",
                "electric-chunk-last-offset", "0_0",
                "electric-schema", "{}",
                "Cache-Control", "no-store"));
    }

    @Test
    public void testCurrentKeepsHeaders() {
        assertEquals(ClientProtocol.CURRENT.translateResponseHeaders(ORIGIN_HEADERS), ORIGIN_HEADERS);
    }

    @Test
    public void testReadOriginHandleUnderEitherName() {
        assertEquals(ClientProtocol.readOriginHandle(ORIGIN_HEADERS), Optional.of("3833821-1721811548143"));
        assertEquals(ClientProtocol.readOriginHandle(ImmutableListMultimap.of("Electric-Shape-Id", "h2")), Optional.of("h2"));
        assertFalse(ClientProtocol.readOriginHandle(ImmutableListMultimap.of("electric-offset", "0_0")).isPresent());
    }
}
