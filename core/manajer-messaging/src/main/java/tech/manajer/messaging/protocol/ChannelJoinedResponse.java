package tech.manajer.messaging.protocol;

public record ChannelJoinedResponse(
    String channelId
) {
}
