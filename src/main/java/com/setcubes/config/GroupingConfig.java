package com.setcubes.config;

import com.setcubes.exception.ConfigurationException;
import com.setcubes.line.GroupingDetector;

/**
 * Geometry used to decide whether two placed tokens touch.
 *
 * @param tokenExtent    width and height of a token in board units
 * @param touchTolerance extra gap still counted as touching
 */
public record GroupingConfig(double tokenExtent, double touchTolerance) {

    public GroupingConfig {
        if (tokenExtent <= 0) {
            throw new ConfigurationException("grouping.token-extent must be positive, got " + tokenExtent);
        }
        if (touchTolerance < 0) {
            throw new ConfigurationException("grouping.touch-tolerance cannot be negative, got " + touchTolerance);
        }
    }

    public static GroupingConfig defaults() {
        return new GroupingConfig(GroupingDetector.DEFAULT_TOKEN_EXTENT, GroupingDetector.DEFAULT_TOUCH_TOLERANCE);
    }

    public GroupingDetector toDetector() {
        return new GroupingDetector(tokenExtent, touchTolerance);
    }
}
