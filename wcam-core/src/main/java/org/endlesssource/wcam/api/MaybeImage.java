package org.endlesssource.wcam.api;

/**
 * Result of polling a webcam for a frame.
 * Either a fresh {@link Image}, a marker saying there is nothing new to show yet,
 * or the {@link CaptureError} that currently prevents capturing.
 */
public sealed interface MaybeImage
        permits Image, CaptureError, MaybeImage.NoNewImageYet, MaybeImage.NotInitializedYet {

    NoNewImageYet NO_NEW_IMAGE_YET = new NoNewImageYet();
    NotInitializedYet NOT_INITIALIZED_YET = new NotInitializedYet();

    /**
     * The latest frame was already handed out and the device has not produced a new one.
     */
    record NoNewImageYet() implements MaybeImage {
    }

    /**
     * The capture has not been opened yet, or is being reopened.
     */
    record NotInitializedYet() implements MaybeImage {
    }
}
