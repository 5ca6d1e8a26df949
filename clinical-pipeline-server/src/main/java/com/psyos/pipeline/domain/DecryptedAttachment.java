package com.psyos.pipeline.domain;

import lombok.ToString;
import lombok.Value;

@Value
public class DecryptedAttachment {

    String mime;

    @ToString.Exclude
    byte[] bytes;
}
