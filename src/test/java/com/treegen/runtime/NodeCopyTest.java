package com.treegen.runtime;

import org.junit.jupiter.api.Test;

import com.treegen.runtime.annotation.SourceLocation;
import com.treegen.runtime.edge.Any;
import com.treegen.runtime.edge.Link;
import com.treegen.runtime.edge.OptLink;
import com.treegen.runtime.fixture.Directory;
import com.treegen.runtime.fixture.Drive;
import com.treegen.runtime.fixture.Entry;
import com.treegen.runtime.fixture.File;
import com.treegen.runtime.fixture.Machine;
import com.treegen.runtime.fixture.Mount;
import com.treegen.runtime.fixture.SampleTrees;
import com.treegen.runtime.fixture.Shortcut;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for shallow copies, deep clones and structural equality.
 */
class NodeCopyTest {

    @Test
    void testCloneIsStructurallyEqual() {
        Machine machine = SampleTrees.machine();
        Machine clone = machine.clone();

        assertThat(clone).isNotSameAs(machine);
        assertThat(clone.equalsStructurally(machine)).isTrue();
        assertThat(machine.equalsStructurally(clone)).isTrue();
    }

    @Test
    void testCloneOwnsNewNodes() {
        Machine machine = SampleTrees.machine();
        Machine clone = machine.clone();

        assertThat(clone.getDrives().get(0)).isNotSameAs(machine.getDrives().get(0));
        assertThat(SampleTrees.systemRoot(clone)).isNotSameAs(SampleTrees.systemRoot(machine));
        assertThat(clone.isWellFormed()).isFalse();
    }

    @Test
    void testCloneKeepsLinkTargets() {
        Directory target = new Directory("target", new Any<>());
        Mount mount = new Mount("m", new Link<>(target));

        Mount clone = mount.clone();

        assertThat(clone.getTarget()).isNotSameAs(mount.getTarget());
        assertThat(clone.getTarget().get()).isSameAs(target);
    }

    @Test
    void testCopySharesChildren() {
        Drive drive = SampleTrees.drive('C', "a", "x");
        Drive copy = drive.copy();

        assertThat(copy).isNotSameAs(drive);
        assertThat(copy.getRootDir()).isNotSameAs(drive.getRootDir());
        assertThat(copy.getRootDir().get()).isSameAs(drive.getRootDir().get());
        assertThat(copy.getLetter()).isEqualTo('C');
    }

    @Test
    void testCopyAndCloneKeepAnnotations() {
        File file = new File("a", "x");
        SourceLocation location = SourceLocation.at("disk.fs", 3, 7);
        file.setAnnotation(location);

        assertThat(file.copy().getAnnotation(SourceLocation.class)).isSameAs(location);
        assertThat(file.clone().getAnnotation(SourceLocation.class)).isSameAs(location);
    }

    @Test
    void testPrimitiveDifference() {
        Drive left = SampleTrees.drive('C', "a", "x");
        Drive right = SampleTrees.drive('C', "a", "y");

        assertThat(left.equalsStructurally(right)).isFalse();
        assertThat(left.equalsStructurally(SampleTrees.drive('C', "a", "x"))).isTrue();
    }

    @Test
    void testNodeTypeDifference() {
        Directory left = new Directory("root", new Any<Entry>().add(new File("a", "")));
        Directory right = new Directory("root", new Any<Entry>().add(new Directory("a", new Any<>())));

        assertThat(left.equalsStructurally(right)).isFalse();
    }

    @Test
    void testListLengthDifference() {
        Directory left = new Directory("root", new Any<Entry>().add(new File("a", "")));
        Directory right = left.clone();
        right.getEntries().add(new File("b", ""));

        assertThat(left.equalsStructurally(right)).isFalse();
    }

    @Test
    void testLinksComparedByPosition() {
        File firstLeft = new File("a", "");
        File secondLeft = new File("b", "");
        Directory left = new Directory("root", new Any<Entry>()
                .add(firstLeft).add(secondLeft).add(new Shortcut("s", new OptLink<>(firstLeft))));

        File firstRight = new File("a", "");
        File secondRight = new File("b", "");
        Directory right = new Directory("root", new Any<Entry>()
                .add(firstRight).add(secondRight).add(new Shortcut("s", new OptLink<>(firstRight))));

        assertThat(left.equalsStructurally(right)).isTrue();

        ((Shortcut) right.getEntries().get(2)).getTarget().set(secondRight);
        assertThat(left.equalsStructurally(right)).isFalse();
    }

    @Test
    void testEmptyAndFilledLinksDiffer() {
        Shortcut left = new Shortcut("s", new OptLink<>());
        Shortcut right = new Shortcut("s", new OptLink<>(new File("a", "")));

        assertThat(left.equalsStructurally(right)).isFalse();
        assertThat(left.equalsStructurally(new Shortcut("s", new OptLink<>()))).isTrue();
    }

    @Test
    void testNullNodes() {
        assertThat(NodeEquality.equal(null, null)).isTrue();
        assertThat(NodeEquality.equal(new File(), null)).isFalse();
    }

    @Test
    void testOwningCycleDoesNotRecurseForever() {
        Directory left = new Directory("loop", new Any<>());
        left.getEntries().add(left);
        Directory right = new Directory("loop", new Any<>());
        right.getEntries().add(right);
        Directory renamed = new Directory("other", new Any<>());
        renamed.getEntries().add(renamed);

        assertThat(left.isWellFormed()).isFalse();
        assertThat(left.equalsStructurally(right)).isTrue();
        assertThat(left.equalsStructurally(renamed)).isFalse();
    }
}
