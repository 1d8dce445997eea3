package com.pixshare.model;

public enum Capability {
    COMMENT,
    REACT,
    UPLOAD,
    CURATE
}
