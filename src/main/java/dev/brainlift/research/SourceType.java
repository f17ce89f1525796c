package dev.brainlift.research;

public enum SourceType {
  ACADEMIC,
  INDUSTRY,
  NEWS,
  BLOG,
  OTHER
}
