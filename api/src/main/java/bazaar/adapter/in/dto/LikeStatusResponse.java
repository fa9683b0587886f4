package bazaar.adapter.in.dto;

public record LikeStatusResponse(String agentId, boolean liked) {}
