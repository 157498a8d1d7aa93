package com.oekaki.relay.dto;

import lombok.Value;

/** Asset id and delete token handed back by the preview host after an upload. */
@Value
public class PreviewAsset {
    String assetId;
    String deleteToken;
}
