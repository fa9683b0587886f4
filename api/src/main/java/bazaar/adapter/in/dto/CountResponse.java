package bazaar.adapter.in.dto;

public record CountResponse(String category, int count) {}
