package am.ik.apilens.client;

import java.util.List;

import am.ik.apilens.record.RequestRecord;

/**
 * Delivers one batch of records to the ingest endpoint.
 */
@FunctionalInterface
public interface BatchSender {

	/**
	 * Sends the batch in a single attempt.
	 * @throws IngestException if the endpoint rejected the batch or could not be reached
	 */
	void send(List<RequestRecord> records) throws IngestException;

}
