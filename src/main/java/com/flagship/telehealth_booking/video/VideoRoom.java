package com.flagship.telehealth_booking.video;

import lombok.Value;

/**
 * A room as created by the video provider.
 */
@Value
public class VideoRoom {
    String name;
    String url;
}
