// IFetcher.java
package com.webshepherd.core.api;

import com.webshepherd.core.http.FetchException;
import com.webshepherd.core.model.FetchedPage;

import java.net.URI;

/** 페처 최소 계약: URL 하나를 받아 HTML 텍스트를 돌려주거나 FetchException. */
public interface IFetcher {
    FetchedPage fetch(URI url) throws FetchException;
}
