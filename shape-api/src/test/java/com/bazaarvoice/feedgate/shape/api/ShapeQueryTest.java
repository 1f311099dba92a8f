package com.bazaarvoice.feedgate.shape.api;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class ShapeQueryTest {

    @Test
    public void testBlankHandleIsFreshSubscription() {
        ShapeQuery query = new ShapeQuery("public.\"TaskRun\"", "\"id\"='run_1'", ImmutableList.of("id"), "");
        assertFalse(query.isResume());
        assertEquals(query.getHandle(), Optional.empty());
    }

    @Test
    public void testHandleMakesResume() {
        ShapeQuery query = new ShapeQuery("public.\"TaskRun\"", "\"id\"='run_1'", ImmutableList.of("id"), "3833821-1721811548143");
        assertTrue(query.isResume());
        assertEquals(query.getHandle(), Optional.of("3833821-1721811548143"));
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testColumnsRequired() {
        new ShapeQuery("public.\"TaskRun\"", "true", ImmutableList.<String>of(), null);
    }

    @Test
    public void testTagTargetCopiesTags() {
        ShapeTarget target = ShapeTarget.forTags(ImmutableList.of("user:1", "org:2"));
        assertEquals(target.getKind(), ShapeTarget.Kind.TAGS);
        assertEquals(target.getTags(), ImmutableList.of("user:1", "org:2"));
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testTenantRequiresEnvironment() {
        new TenantEnvironment("", "org_1");
    }
}
