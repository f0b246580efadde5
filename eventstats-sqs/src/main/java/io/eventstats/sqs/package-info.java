/**
 * Amazon SQS adapter for {@link io.eventstats.spi.QueueGateway}, built on the AWS SDK v2
 * synchronous {@code SqsClient}. Works against LocalStack by pointing the client at its endpoint.
 */
package io.eventstats.sqs;
