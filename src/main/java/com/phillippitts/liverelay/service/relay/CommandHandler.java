package com.phillippitts.liverelay.service.relay;

/**
 * One handler method per {@link ControllerCommand} variant.
 */
public interface CommandHandler {

    void onStart(ControllerCommand.Start command);

    void onStop(ControllerCommand.Stop command);

    void onMessage(ControllerCommand.Message command);

    void onInterrupt(ControllerCommand.Interrupt command);

    void onStartTranscription(ControllerCommand.StartTranscription command);

    void onStopTranscription(ControllerCommand.StopTranscription command);

    void onAddServer(ControllerCommand.AddServer command);

    void onRemoveServer(ControllerCommand.RemoveServer command);

    void onGetTools(ControllerCommand.GetTools command);

    void onGetServerTools(ControllerCommand.GetServerTools command);

    void onExecuteTool(ControllerCommand.ExecuteTool command);

    void onGetStatus(ControllerCommand.GetStatus command);
}
