package com.ttennebkram.schematic.processing;

import com.ttennebkram.schematic.model.PixelPoint;
import com.ttennebkram.schematic.model.RawSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses duplicate detections of the same stroke.
 *
 * A thick drawn line produces two parallel edge lines after Canny, and the
 * line transform often reports the same stroke more than once. Two segments
 * are merged when both corresponding endpoint pairs are closer than the merge
 * distance. Single greedy pass in input order: each unused segment seeds a
 * group, later unused segments close to the seed join it, and the group is
 * replaced by one segment spanning its outermost endpoints.
 *
 * O(n^2) in segment count; a schematic yields tens of segments, not thousands.
 */
public class SegmentMerger {

    private final double distanceThreshold;

    public SegmentMerger(double distanceThreshold) {
        this.distanceThreshold = distanceThreshold;
    }

    public List<RawSegment> merge(List<RawSegment> segments) {
        List<RawSegment> merged = new ArrayList<>();
        if (segments == null || segments.isEmpty()) {
            return merged;
        }

        boolean[] used = new boolean[segments.size()];
        for (int i = 0; i < segments.size(); i++) {
            if (used[i]) continue;
            used[i] = true;

            RawSegment seed = segments.get(i);
            PixelPoint first = seed.getP1();
            PixelPoint last = seed.getP2();

            for (int j = i + 1; j < segments.size(); j++) {
                if (used[j]) continue;
                RawSegment other = segments.get(j);

                if (seed.getP1().distanceTo(other.getP1()) < distanceThreshold
                        && seed.getP2().distanceTo(other.getP2()) < distanceThreshold) {
                    // Extend outward along the seed's direction
                    if (other.getP1().distanceTo(seed.getP2()) > first.distanceTo(seed.getP2())) {
                        first = other.getP1();
                    }
                    if (other.getP2().distanceTo(seed.getP1()) > last.distanceTo(seed.getP1())) {
                        last = other.getP2();
                    }
                    used[j] = true;
                }
            }

            merged.add(new RawSegment(first.x, first.y, last.x, last.y));
        }
        return merged;
    }
}
