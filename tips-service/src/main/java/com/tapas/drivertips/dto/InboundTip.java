package com.tapas.drivertips.dto;

/**
 * One undecoded item of a delivered batch. id is whatever the delivery system uses to
 * redeliver the item.
 */
public record InboundTip(
        String id,
        String rawPayload) {
}
