package com.example.munchdfa;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StateSetTest {

    @Test
    public void sameMembersInAnyOrderAreEqual() {
        StateSet a = StateSet.of(5, 1, 3, 1);
        StateSet b = StateSet.of(Arrays.asList(3, 5, 1));
        assertThat(a, equalTo(b));
        assertThat(a.hashCode(), is(b.hashCode()));
        assertThat(a.size(), is(3));
        assertThat(a.toString(), is("{1, 3, 5}"));
    }

    @Test
    public void worksAsMapKey() {
        Map<StateSet, Integer> index = new HashMap<>();
        index.put(StateSet.of(2, 7), 0);
        assertThat(index.get(StateSet.of(7, 2)), is(0));
    }

    @Test
    public void contains() {
        StateSet set = StateSet.of(10, 0, 4);
        assertTrue(set.contains(0));
        assertTrue(set.contains(10));
        assertFalse(set.contains(5));
        assertTrue(StateSet.of().isEmpty());
        assertThat(StateSet.of(), equalTo(StateSet.empty()));
    }

    @Test
    public void toArrayIsACopy() {
        StateSet set = StateSet.of(1, 2);
        set.toArray()[0] = 99;
        assertThat(set, equalTo(StateSet.of(1, 2)));
    }
}
