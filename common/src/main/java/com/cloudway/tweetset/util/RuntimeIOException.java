/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.util;

import java.io.IOException;

/**
 * Wraps an IOException to a RuntimeException that can be thrown
 * from a lambda expression or a memoized supplier.
 */
public class RuntimeIOException extends RuntimeException
{
    private static final long serialVersionUID = 3871605372240919128L;

    public RuntimeIOException(IOException ex) {
        super(ex);
    }

    @Override
    public IOException getCause() {
        return (IOException)super.getCause();
    }
}
