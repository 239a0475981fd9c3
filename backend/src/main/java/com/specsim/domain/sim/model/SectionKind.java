package com.specsim.domain.sim.model;

public enum SectionKind {
    MESSAGE,
    DICTIONARY,
    APPENDIX,
    OTHER
}
