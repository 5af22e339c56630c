package com.libragraph.vcl.core.reclaim;

import com.libragraph.vcl.core.dao.BlobRecord;

public record DeletedBlob(long blobId, String digest, long freedBytes) {

    static DeletedBlob of(BlobRecord blob, long freedBytes) {
        return new DeletedBlob(blob.id(), blob.digest(), freedBytes);
    }
}
