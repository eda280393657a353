package com.blogpulse.store;

public record ScoredMember(String member, double score) {
}
